package com.snubalink.service.core.options;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Extra top-level fields merged into every legacy query body while a {@link Scope} is open, e.g.
 * {@code consistent=true} for a block of read-after-write queries.
 *
 * <p>Scopes nest and must be closed in reverse order of opening. Overlapping scopes opened from
 * different threads see each other's values; there is no per-thread isolation.
 */
public class QueryOptionOverrides {

    private final Map<String, Object> active = new LinkedHashMap<>();

    public synchronized Map<String, Object> current() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(active));
    }

    /** Applies {@code overrides} until the returned scope is closed. */
    public synchronized Scope override(Map<String, ?> overrides) {
        Map<String, Object> previous = new HashMap<>();
        Set<String> added = new HashSet<>();
        overrides.forEach((key, value) -> {
            if (active.containsKey(key)) {
                previous.put(key, active.get(key));
            } else {
                added.add(key);
            }
            active.put(key, value);
        });
        return new Scope(previous, added);
    }

    private synchronized void restore(Map<String, Object> previous, Set<String> added) {
        active.putAll(previous);
        added.forEach(active::remove);
    }

    public final class Scope implements AutoCloseable {
        private final Map<String, Object> previous;
        private final Set<String> added;
        private boolean closed;

        private Scope(Map<String, Object> previous, Set<String> added) {
            this.previous = previous;
            this.added = added;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            restore(previous, added);
        }
    }
}
