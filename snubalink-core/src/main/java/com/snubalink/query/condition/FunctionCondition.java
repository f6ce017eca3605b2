package com.snubalink.query.condition;

import java.util.Objects;

/** A boolean function call used directly as a condition, e.g. {@code has(tags.key, 'foo')}. */
public record FunctionCondition(FunctionCall call) implements Condition {

    public FunctionCondition {
        Objects.requireNonNull(call, "call");
    }
}
