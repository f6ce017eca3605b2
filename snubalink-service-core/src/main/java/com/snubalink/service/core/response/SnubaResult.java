package com.snubalink.service.core.response;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoded body of a successful query.
 *
 * @param data result rows, already translated back to ids
 * @param meta column descriptors, each with at least {@code name} and {@code type}
 * @param totals totals row, or null when totals were not requested
 */
public record SnubaResult(List<Map<String, Object>> data, List<Map<String, Object>> meta, Map<String, Object> totals) {

    public SnubaResult {
        data = data == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(data));
        meta = meta == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(meta));
        totals = totals == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(totals));
    }

    public static SnubaResult empty() {
        return new SnubaResult(List.of(), List.of(), null);
    }

    /** Column names from {@code meta}, in order. */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(meta.size());
        meta.forEach(column -> names.add(String.valueOf(column.get("name"))));
        return names;
    }
}
