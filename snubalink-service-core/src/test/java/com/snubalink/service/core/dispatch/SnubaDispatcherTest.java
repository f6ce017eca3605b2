package com.snubalink.service.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.snubalink.client.testkit.ScriptedSnubaTransport;
import com.snubalink.client.transport.SnubaHttpResponse;
import com.snubalink.query.Dataset;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.query.condition.Condition;
import com.snubalink.query.condition.Expression;
import com.snubalink.query.exception.SnubaException;
import com.snubalink.service.core.params.OrganizationScope;
import com.snubalink.service.core.params.PreparedQuery;
import com.snubalink.service.core.snql.SnqlQuery;
import com.snubalink.service.core.telemetry.SnubaTelemetryRegistry;
import com.snubalink.service.core.translate.SnubaTranslators;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class SnubaDispatcherTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-02T00:00:00Z");

    private ScriptedSnubaTransport transport;
    private SnubaTelemetryRegistry telemetry;
    private SnubaDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        transport = new ScriptedSnubaTransport();
        telemetry = new SnubaTelemetryRegistry();
        dispatcher = new SnubaDispatcher(transport, telemetry, 4);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        MDC.clear();
    }

    private static SnubaRequest legacy(int limit) {
        SnubaQueryParams params = SnubaQueryParams.builder(Dataset.EVENTS)
                .filter("project_id", List.of(1))
                .limit(limit)
                .build();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dataset", "events");
        body.put("limit", limit);
        return SnubaRequest.legacy(new PreparedQuery(
                params,
                body,
                SnubaTranslators.identity(),
                new OrganizationScope(7, List.of(1L), false),
                List.of(Condition.in("project_id", List.of(1))),
                START,
                END));
    }

    @Test
    void batchResultsKeepRequestOrderUnderRandomLatency() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        transport.respondWith(call -> {
            threads.add(Thread.currentThread().getName());
            try {
                Thread.sleep(ThreadLocalRandom.current().nextInt(25));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return SnubaHttpResponse.of(200, call.bodyAsString());
        });
        List<SnubaRequest> requests = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            requests.add(legacy(i));
        }

        List<SnubaHttpResponse> responses = dispatcher.execute(requests, "test.order", false);

        assertThat(responses).hasSize(20);
        for (int i = 0; i < 20; i++) {
            assertThat(responses.get(i).bodyAsString()).contains("\"limit\":" + i + ",");
        }
        assertThat(threads).allMatch(name -> name.startsWith("snuba-query-"));
        assertThat(telemetry.snapshot().queries()).isEqualTo(20);
    }

    @Test
    void singleRequestRunsOnCallerThread() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        transport.respondWith(call -> {
            threads.add(Thread.currentThread().getName());
            return SnubaHttpResponse.of(200, "{\"data\":[]}");
        });

        dispatcher.execute(List.of(legacy(1)), "test.inline", false);

        assertThat(threads).containsExactly(Thread.currentThread().getName());
    }

    @Test
    void legacyQueriesPostToQueryWithRefererAndParentApi() {
        MDC.put(SnubaDispatcher.PARENT_API_MDC_KEY, "api.issues");

        dispatcher.execute(List.of(legacy(3)), "api.group-events", false);

        ScriptedSnubaTransport.Call call = transport.lastCall();
        assertThat(call.path()).isEqualTo("/query");
        assertThat(call.headers()).containsEntry("referer", "api.group-events");
        assertThat(call.bodyAsString())
                .isEqualTo("{\"dataset\":\"events\",\"limit\":3,\"parent_api\":\"api.issues\"}");
    }

    @Test
    void parentApiDefaultsToMissing() {
        dispatcher.execute(List.of(legacy(3)), "ref", false);

        assertThat(transport.lastCall().bodyAsString()).contains("\"parent_api\":\"<missing>\"");
    }

    @Test
    void workersSeeTheCallersMdc() {
        MDC.put(SnubaDispatcher.PARENT_API_MDC_KEY, "api.batch");
        Set<String> seen = ConcurrentHashMap.newKeySet();
        transport.respondWith(call -> {
            seen.add(String.valueOf(MDC.get(SnubaDispatcher.PARENT_API_MDC_KEY)));
            return SnubaHttpResponse.of(200, "{}");
        });

        dispatcher.execute(List.of(legacy(1), legacy(2), legacy(3)), "ref", false);

        assertThat(seen).containsExactly("api.batch");
        assertThat(transport.calls()).allMatch(call -> call.bodyAsString().contains("\"parent_api\":\"api.batch\""));
    }

    @Test
    void structuredQueriesPostToTheDatasetEndpoint() {
        SnqlQuery query = SnqlQuery.builder("events")
                .select(Expression.column("title"))
                .consistent(true)
                .build();

        dispatcher.execute(List.of(SnubaRequest.snql(query)), "ref", false);

        ScriptedSnubaTransport.Call call = transport.lastCall();
        assertThat(call.path()).isEqualTo("/events/snql");
        assertThat(call.bodyAsString())
                .isEqualTo("{\"dataset\":\"events\",\"query\":\"MATCH (events) SELECT title\","
                        + "\"consistent\":true,\"parent_api\":\"<missing>\"}");
    }

    @Test
    void legacyQueriesCanBeSentAsSnql() {
        dispatcher.execute(List.of(legacy(3)), "ref", true);

        ScriptedSnubaTransport.Call call = transport.lastCall();
        assertThat(call.path()).isEqualTo("/events/snql");
        assertThat(call.bodyAsString())
                .contains("\"legacy\":true")
                .contains("MATCH (events)")
                .contains("project_id IN tuple(1)")
                .contains("LIMIT 3");
    }

    @Test
    void mixedBatchesAreRejected() {
        SnubaRequest structured = SnubaRequest.snql(SnqlQuery.builder("events").build());

        assertThatThrownBy(() -> dispatcher.execute(List.of(legacy(1), structured), "ref", false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(transport.calls()).isEmpty();
    }

    @Test
    void transportFailuresSurfaceAsSnubaException() {
        transport.respondWith(call -> {
            throw new SocketTimeoutException("timeout");
        });

        assertThatThrownBy(() -> dispatcher.execute(List.of(legacy(1), legacy(2)), "ref", false))
                .isInstanceOf(SnubaException.class)
                .hasCauseInstanceOf(SocketTimeoutException.class);
        assertThat(telemetry.snapshot().failuresByType()).containsKey("SocketTimeoutException");
    }

    @Test
    void emptyBatchSendsNothing() {
        assertThat(dispatcher.execute(List.of(), "ref", false)).isEmpty();
        assertThat(transport.calls()).isEmpty();
    }
}
