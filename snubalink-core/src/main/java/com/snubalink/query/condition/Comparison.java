package com.snubalink.query.condition;

import java.util.Objects;

/** Leaf condition {@code [lhs, operator, value]}. The value is a literal and is never resolved. */
public record Comparison(Expression lhs, Operator operator, Object value) implements Condition {

    public Comparison {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(operator, "operator");
    }

    public Comparison withLhs(Expression newLhs) {
        return new Comparison(newLhs, operator, value);
    }
}
