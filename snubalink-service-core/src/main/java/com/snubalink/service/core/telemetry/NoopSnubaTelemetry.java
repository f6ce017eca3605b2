package com.snubalink.service.core.telemetry;

import java.time.Duration;

public class NoopSnubaTelemetry implements SnubaTelemetry {
    @Override
    public void recordQuery(QueryTags tags, int status, Duration elapsed) {}

    @Override
    public void recordFailure(QueryTags tags, String errorType) {}

    @Override
    public void recordCacheLookup(int hits, int misses) {}
}
