package com.snubalink.service.core.telemetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.snubalink.service.core.telemetry.SnubaTelemetry.QueryTags;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SnubaTelemetryRegistryTest {

    private static final QueryTags ISSUES = new QueryTags("api.issues", "api.issues", "events", "/query");

    @Test
    void countsQueriesPerTagSet() {
        SnubaTelemetryRegistry registry = new SnubaTelemetryRegistry();

        registry.recordQuery(ISSUES, 200, Duration.ofMillis(40));
        registry.recordQuery(ISSUES, 200, Duration.ofMillis(2));
        registry.recordQuery(new QueryTags(null, "<missing>", "sessions", "/query"), 500, null);

        SnubaTelemetryRegistry.Snapshot snapshot = registry.snapshot();
        assertThat(snapshot.queries()).isEqualTo(3);
        assertThat(snapshot.elapsedMillis()).isEqualTo(42);
        assertThat(snapshot.queriesByTags()).containsEntry(ISSUES, 2L).hasSize(2);
    }

    @Test
    void countsFailuresByType() {
        SnubaTelemetryRegistry registry = new SnubaTelemetryRegistry();

        registry.recordFailure(ISSUES, "SocketTimeoutException");
        registry.recordFailure(ISSUES, "SocketTimeoutException");
        registry.recordFailure(ISSUES, "ConnectException");

        assertThat(registry.snapshot().failures()).isEqualTo(3);
        assertThat(registry.snapshot().failuresByType())
                .containsEntry("SocketTimeoutException", 2L)
                .containsEntry("ConnectException", 1L);
    }

    @Test
    void cacheLookupsIgnoreEmptyBatches() {
        SnubaTelemetryRegistry registry = new SnubaTelemetryRegistry();

        registry.recordCacheLookup(3, 1);
        registry.recordCacheLookup(0, 0);

        assertThat(registry.snapshot().cacheHits()).isEqualTo(3);
        assertThat(registry.snapshot().cacheMisses()).isEqualTo(1);
    }

    @Test
    void noopAcceptsEverything() {
        SnubaTelemetry noop = new NoopSnubaTelemetry();

        assertThatCode(() -> {
                    noop.recordQuery(ISSUES, 200, null);
                    noop.recordFailure(ISSUES, "IOException");
                    noop.recordCacheLookup(1, 1);
                })
                .doesNotThrowAnyException();
    }
}
