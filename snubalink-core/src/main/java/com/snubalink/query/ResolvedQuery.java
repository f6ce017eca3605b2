package com.snubalink.query;

import java.util.Map;

/**
 * A query rewritten to backend column names, with the mapping needed to rename result columns
 * back to the names the caller used.
 */
public record ResolvedQuery(SnubaQueryParams params, Map<String, String> translatedColumns) {

    public ResolvedQuery {
        translatedColumns = Map.copyOf(translatedColumns);
    }

    /** Public name for a backend column, or the column itself when it was never renamed. */
    public String publicName(String column) {
        return translatedColumns.getOrDefault(column, column);
    }
}
