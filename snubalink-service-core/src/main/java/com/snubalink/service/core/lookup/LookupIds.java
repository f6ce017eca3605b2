package com.snubalink.service.core.lookup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Numeric ids taken from loosely typed filter values. */
public final class LookupIds {

    private LookupIds() {}

    /** Distinct ids in first-seen order. Nulls and non-numeric values are skipped. */
    public static List<Long> distinct(Collection<?> values) {
        Set<Long> ids = new LinkedHashSet<>();
        if (values != null) {
            for (Object value : values) {
                Long id = toLong(value);
                if (id != null) {
                    ids.add(id);
                }
            }
        }
        return new ArrayList<>(ids);
    }

    public static Long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
