package com.snubalink.query.result;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Folds flat result rows into nested maps keyed by group-by values. */
public final class ResultNesting {

    private ResultNesting() {}

    /**
     * With no group-by columns the first row's aggregates are returned: the bare value when there
     * is exactly one aggregate, otherwise a map of aggregate to value. No rows gives {@code null}.
     * With group-by columns the rows are partitioned by the first column, keys in first-seen
     * order, and each partition is nested by the remaining columns.
     */
    public static Object nestGroups(List<Map<String, Object>> rows, List<String> groupby, List<String> aggregates) {
        if (groupby.isEmpty()) {
            if (rows.isEmpty()) {
                return null;
            }
            Map<String, Object> first = rows.get(0);
            if (aggregates.size() == 1) {
                return first.get(aggregates.get(0));
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (String aggregate : aggregates) {
                values.put(aggregate, first.get(aggregate));
            }
            return values;
        }

        String column = groupby.get(0);
        List<String> rest = groupby.subList(1, groupby.size());
        Map<Object, List<Map<String, Object>>> partitions = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            partitions.computeIfAbsent(row.get(column), k -> new ArrayList<>()).add(row);
        }
        Map<Object, Object> nested = new LinkedHashMap<>();
        partitions.forEach((key, partition) -> nested.put(key, nestGroups(partition, rest, aggregates)));
        return nested;
    }
}
