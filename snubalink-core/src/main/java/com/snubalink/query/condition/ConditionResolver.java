package com.snubalink.query.condition;

import com.snubalink.query.ColumnResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites public column names inside conditions and column expressions to backend columns.
 *
 * <p>Only positions that denote columns are touched: the left-hand side of leaf conditions, the
 * first argument of comparison functions and the column arguments of any other function. Right
 * hand sides and literal arguments are left alone. Inputs are never mutated.
 */
public final class ConditionResolver {

    private static final Set<String> LOGICAL_FUNCTIONS = Set.of("and", "or");

    private ConditionResolver() {}

    public static Condition resolve(Condition condition, ColumnResolver resolver) {
        if (condition instanceof Comparison c) {
            return c.withLhs(resolveColumnPosition(c.lhs(), resolver));
        }
        if (condition instanceof Membership m) {
            return m.withLhs(resolveColumnPosition(m.lhs(), resolver));
        }
        if (condition instanceof FunctionCondition f) {
            return new FunctionCondition(resolveCall(f.call(), resolver));
        }
        AnyOf any = (AnyOf) condition;
        List<Condition> alternatives = new ArrayList<>(any.alternatives().size());
        for (Condition alternative : any.alternatives()) {
            alternatives.add(resolve(alternative, resolver));
        }
        return new AnyOf(alternatives);
    }

    public static FunctionCall resolveCall(FunctionCall call, ColumnResolver resolver) {
        List<Expression> args = call.args();
        List<Expression> resolved = new ArrayList<>(args.size());
        if (Operator.isComparisonFunction(call.function())) {
            for (int i = 0; i < args.size(); i++) {
                Expression arg = args.get(i);
                resolved.add(i == 0 ? resolveColumnPosition(arg, resolver) : asLiteral(arg));
            }
        } else if (LOGICAL_FUNCTIONS.contains(call.function())) {
            for (Expression arg : args) {
                resolved.add(arg instanceof FunctionCall nested ? resolveCall(nested, resolver) : arg);
            }
        } else {
            for (Expression arg : args) {
                resolved.add(resolveColumnPosition(arg, resolver));
            }
        }
        return call.withArgs(resolved);
    }

    /**
     * Resolves every column argument of a selected or aggregated expression, recursing into
     * nested calls. Names in {@code ignored} are aliases derived inside the same query and stay as
     * they are.
     */
    public static FunctionCall resolveComplexColumn(
            FunctionCall call, ColumnResolver resolver, Set<String> ignored) {
        List<Expression> resolved = new ArrayList<>(call.args().size());
        for (Expression arg : call.args()) {
            if (arg instanceof FunctionCall nested) {
                resolved.add(resolveComplexColumn(nested, resolver, ignored));
            } else if (arg instanceof Expression.Column column && !ignored.contains(column.name())) {
                resolved.add(Expression.column(resolver.resolve(column.name())));
            } else {
                resolved.add(arg);
            }
        }
        return call.withArgs(resolved);
    }

    private static Expression resolveColumnPosition(Expression expression, ColumnResolver resolver) {
        if (expression instanceof Expression.Column column) {
            return Expression.column(resolver.resolve(column.name()));
        }
        if (expression instanceof FunctionCall call) {
            return resolveCall(call, resolver);
        }
        return expression;
    }

    // a bare name on the right of a comparison function is a value, not a column
    private static Expression asLiteral(Expression expression) {
        if (expression instanceof Expression.Column column) {
            return Expression.literal(column.name());
        }
        return expression;
    }
}
