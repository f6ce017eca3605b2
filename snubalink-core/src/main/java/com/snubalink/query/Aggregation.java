package com.snubalink.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code [function, column(s), alias]}, e.g. {@code ["uniq", "tags[sentry:user]", "users"]} or
 * {@code ["count()", "", "aggregate"]}.
 */
public record Aggregation(String function, List<String> columns, String alias) {

    public Aggregation {
        Objects.requireNonNull(function, "function");
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static Aggregation of(String function, String column, String alias) {
        return new Aggregation(function, column == null || column.isEmpty() ? List.of() : List.of(column), alias);
    }

    public static Aggregation count(String alias) {
        return new Aggregation("count()", List.of(), alias);
    }

    public Aggregation withColumns(List<String> newColumns) {
        return new Aggregation(function, newColumns, alias);
    }

    /** Positional wire form. A single column is sent bare, no column as an empty string. */
    public List<Object> toPositional() {
        Object column;
        if (columns.isEmpty()) {
            column = "";
        } else if (columns.size() == 1) {
            column = columns.get(0);
        } else {
            column = new ArrayList<Object>(columns);
        }
        List<Object> out = new ArrayList<>(3);
        out.add(function);
        out.add(column);
        out.add(alias);
        return out;
    }
}
