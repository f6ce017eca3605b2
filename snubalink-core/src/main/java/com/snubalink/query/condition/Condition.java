package com.snubalink.query.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter node of a query. A top-level condition list is an AND of its items; {@link AnyOf} nests
 * an OR group.
 */
public sealed interface Condition permits Comparison, Membership, FunctionCondition, AnyOf {

    static Comparison of(String column, Operator op, Object value) {
        return new Comparison(Expression.column(column), op, value);
    }

    static Comparison isNull(String column) {
        return new Comparison(Expression.column(column), Operator.IS_NULL, null);
    }

    static Membership in(String column, List<?> values) {
        return new Membership(Expression.column(column), false, new ArrayList<>(values));
    }

    static AnyOf anyOf(Condition... alternatives) {
        return new AnyOf(List.of(alternatives));
    }
}
