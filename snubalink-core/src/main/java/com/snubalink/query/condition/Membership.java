package com.snubalink.query.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code [lhs, "IN", [values]]} or {@code [lhs, "NOT IN", [values]]}. Looks like a function call in
 * the positional form but its right-hand side is a literal list.
 */
public record Membership(Expression lhs, boolean negated, List<Object> values) implements Condition {

    public Membership {
        Objects.requireNonNull(lhs, "lhs");
        // values may legitimately contain null, so List.copyOf is not an option
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public String symbol() {
        return negated ? "NOT IN" : "IN";
    }

    public Membership withLhs(Expression newLhs) {
        return new Membership(newLhs, negated, values);
    }
}
