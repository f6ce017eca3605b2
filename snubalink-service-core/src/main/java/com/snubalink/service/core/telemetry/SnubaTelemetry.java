package com.snubalink.service.core.telemetry;

import java.time.Duration;

/** Fire-and-forget metrics sink for backend calls. Implementations must never throw. */
public interface SnubaTelemetry {
    void recordQuery(QueryTags tags, int status, Duration elapsed);

    void recordFailure(QueryTags tags, String errorType);

    void recordCacheLookup(int hits, int misses);

    record QueryTags(String referrer, String parentApi, String dataset, String path) {}
}
