package com.snubalink.service.core.telemetry;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/** In-process counters, readable through {@link #snapshot()}. */
public class SnubaTelemetryRegistry implements SnubaTelemetry {
    private final LongAdder queries = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder elapsedMillis = new LongAdder();

    private final Map<QueryTags, LongAdder> queriesByTags = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> failuresByType = new ConcurrentHashMap<>();

    @Override
    public void recordQuery(QueryTags tags, int status, Duration elapsed) {
        queries.increment();
        queriesByTags.computeIfAbsent(tags, key -> new LongAdder()).increment();
        if (elapsed != null) {
            elapsedMillis.add(elapsed.toMillis());
        }
    }

    @Override
    public void recordFailure(QueryTags tags, String errorType) {
        failures.increment();
        failuresByType.computeIfAbsent(errorType, key -> new LongAdder()).increment();
    }

    @Override
    public void recordCacheLookup(int hits, int misses) {
        if (hits > 0) {
            cacheHits.add(hits);
        }
        if (misses > 0) {
            cacheMisses.add(misses);
        }
    }

    public Snapshot snapshot() {
        Map<QueryTags, Long> byTags = new HashMap<>();
        queriesByTags.forEach((tags, count) -> byTags.put(tags, count.sum()));
        Map<String, Long> byType = new HashMap<>();
        failuresByType.forEach((type, count) -> byType.put(type, count.sum()));
        return new Snapshot(
                queries.sum(), failures.sum(), cacheHits.sum(), cacheMisses.sum(), elapsedMillis.sum(), byTags, byType);
    }

    public record Snapshot(
            long queries,
            long failures,
            long cacheHits,
            long cacheMisses,
            long elapsedMillis,
            Map<QueryTags, Long> queriesByTags,
            Map<String, Long> failuresByType) {}
}
