package com.snubalink.query.condition;

import java.util.List;

/** OR group: a nested list of conditions in the positional form. */
public record AnyOf(List<Condition> alternatives) implements Condition {

    public AnyOf {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }
}
