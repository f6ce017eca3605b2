package com.snubalink.service.core.translate;

import com.snubalink.query.IsoTimes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Per-query pair of rewrites: {@code forward} turns id-valued filter keys into the values the
 * backend stores, {@code reverse} maps result rows back to ids. Both return new maps and never
 * modify their argument, so one instance can be shared between threads.
 */
public final class SnubaTranslators {

    static final List<String> TIME_COLUMNS = List.of("time", "bucketed_end");

    private static final SnubaTranslators IDENTITY =
            new SnubaTranslators(UnaryOperator.identity(), UnaryOperator.identity()).withTimeColumns();

    private final UnaryOperator<Map<String, List<Object>>> forward;
    private final UnaryOperator<Map<String, Object>> reverse;

    SnubaTranslators(UnaryOperator<Map<String, List<Object>>> forward, UnaryOperator<Map<String, Object>> reverse) {
        this.forward = forward;
        this.reverse = reverse;
    }

    /** No id mapping at all; still converts datetime columns on the way back. */
    public static SnubaTranslators identity() {
        return IDENTITY;
    }

    public Map<String, List<Object>> forward(Map<String, List<Object>> filterKeys) {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        filterKeys.forEach((key, values) -> copy.put(key, new ArrayList<>(values)));
        return forward.apply(copy);
    }

    public Map<String, Object> reverse(Map<String, Object> row) {
        return reverse.apply(new LinkedHashMap<>(row));
    }

    /** Rewrites every row, preserving order. */
    public List<Map<String, Object>> reverseAll(List<Map<String, Object>> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        rows.forEach(row -> out.add(reverse(row)));
        return out;
    }

    SnubaTranslators withForward(UnaryOperator<Map<String, List<Object>>> step) {
        return new SnubaTranslators(compose(forward, step), reverse);
    }

    SnubaTranslators withReverse(UnaryOperator<Map<String, Object>> step) {
        return new SnubaTranslators(forward, compose(reverse, step));
    }

    SnubaTranslators withTimeColumns() {
        SnubaTranslators translators = this;
        for (String column : TIME_COLUMNS) {
            translators = translators.withReverse(row -> {
                if (row.get(column) instanceof String value) {
                    row.put(column, IsoTimes.toEpochSeconds(value));
                }
                return row;
            });
        }
        return translators;
    }

    private static <T> UnaryOperator<T> compose(UnaryOperator<T> first, UnaryOperator<T> then) {
        return value -> then.apply(first.apply(value));
    }
}
