package com.snubalink.query.result;

import com.snubalink.query.IsoTimes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Pads a time series so that every rollup bucket in the window has at least one row. */
public final class Zerofill {

    public static final String TIME = "time";

    private Zerofill() {}

    /**
     * Buckets run from {@code floor(start)} up to and including {@code floor(end)}. Existing rows
     * are kept in bucket order, with datetime strings in {@code time} turned into epoch seconds;
     * empty buckets get a row holding only {@code time}. The series is
     * reversed when {@code orderby} contains {@code -time}.
     *
     * @param rollup bucket width in seconds, must be positive
     */
    public static List<Map<String, Object>> fill(
            List<Map<String, Object>> rows, Instant start, Instant end, int rollup, Collection<String> orderby) {
        if (rollup <= 0) {
            throw new IllegalArgumentException("rollup must be positive: " + rollup);
        }
        long first = Math.floorDiv(start.getEpochSecond(), rollup) * rollup;
        long last = Math.floorDiv(end.getEpochSecond(), rollup) * rollup + rollup;

        Map<Long, List<Map<String, Object>>> byTime = new HashMap<>();
        for (Map<String, Object> row : rows) {
            Object raw = row.get(TIME);
            Long time = epochSeconds(raw);
            if (time == null) {
                continue;
            }
            if (raw instanceof String) {
                row = new LinkedHashMap<>(row);
                row.put(TIME, time);
            }
            byTime.computeIfAbsent(time, k -> new ArrayList<>()).add(row);
        }

        List<Map<String, Object>> filled = new ArrayList<>();
        for (long bucket = first; bucket < last; bucket += rollup) {
            List<Map<String, Object>> existing = byTime.remove(bucket);
            if (existing != null) {
                filled.addAll(existing);
            } else {
                Map<String, Object> empty = new LinkedHashMap<>();
                empty.put(TIME, bucket);
                filled.add(empty);
            }
        }
        if (orderby != null && orderby.contains("-" + TIME)) {
            Collections.reverse(filled);
        }
        return filled;
    }

    private static Long epochSeconds(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            return IsoTimes.toEpochSeconds(text);
        }
        return null;
    }
}
