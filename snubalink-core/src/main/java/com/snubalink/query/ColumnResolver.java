package com.snubalink.query;

import java.util.Collection;

/** Maps a public field or tag name to the backend column of one dataset. */
@FunctionalInterface
public interface ColumnResolver {

    String resolve(String name);

    /**
     * Resolves values that may not be names at all: numbers and list expressions are returned
     * unchanged, strings go through {@link #resolve(String)}.
     */
    default Object resolveValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Collection<?>) {
            return value;
        }
        if (value instanceof String name) {
            return resolve(name);
        }
        return value;
    }
}
