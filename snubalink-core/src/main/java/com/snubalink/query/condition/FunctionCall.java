package com.snubalink.query.condition;

import java.util.List;
import java.util.Objects;

/**
 * Function application, optionally aliased: {@code [function, [args...], alias]} in the legacy
 * positional form.
 */
public record FunctionCall(String function, List<Expression> args, String alias) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(function, "function");
        args = args == null ? List.of() : List.copyOf(args);
    }

    public FunctionCall withArgs(List<Expression> newArgs) {
        return new FunctionCall(function, newArgs, alias);
    }
}
