package com.snubalink.service.core.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snubalink.client.transport.SnubaHttpResponse;
import com.snubalink.client.transport.SnubaTransport;
import com.snubalink.query.exception.SnubaException;
import com.snubalink.service.core.snql.LegacySnqlConverter;
import com.snubalink.service.core.snql.SnqlQuery;
import com.snubalink.service.core.telemetry.SnubaTelemetry;
import com.snubalink.service.core.telemetry.SnubaTelemetry.QueryTags;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Sends batches of queries to the backend. A single query runs on the caller's thread; larger
 * batches fan out over a fixed pool and are joined before returning. Responses come back in
 * request order.
 */
@Slf4j
public class SnubaDispatcher implements Closeable {

    public static final String PARENT_API_MDC_KEY = "parentApi";
    static final String MISSING_PARENT_API = "<missing>";
    static final String LEGACY_PATH = "/query";

    private static final ObjectMapper JSON = new ObjectMapper();

    private final SnubaTransport transport;
    private final SnubaTelemetry telemetry;
    private final ExecutorService pool;
    private final Tracer tracer;

    public SnubaDispatcher(SnubaTransport transport, SnubaTelemetry telemetry, int poolSize) {
        this.transport = transport;
        this.telemetry = telemetry;
        this.pool = Executors.newFixedThreadPool(poolSize, daemonThreads());
        this.tracer = GlobalOpenTelemetry.getTracer("com.snubalink");
        log.info("Snuba dispatcher started poolSize={}, url={}", poolSize, transport.baseUrl());
    }

    public List<SnubaHttpResponse> execute(List<SnubaRequest> requests, String referrer, boolean useSnql) {
        WireProtocol protocol = WireProtocol.forBatch(requests, useSnql);
        if (requests.isEmpty()) {
            return List.of();
        }
        String parentApi = MDC.get(PARENT_API_MDC_KEY);
        String parent = parentApi == null || parentApi.isBlank() ? MISSING_PARENT_API : parentApi;
        if (requests.size() == 1) {
            return List.of(call(requests.get(0), protocol, referrer, parent));
        }

        Context context = Context.current();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<SnubaHttpResponse>> futures = new ArrayList<>(requests.size());
        for (SnubaRequest request : requests) {
            Callable<SnubaHttpResponse> task = () -> call(request, protocol, referrer, parent);
            futures.add(pool.submit(context.wrap(withMdc(mdc, task))));
        }
        SnubaHttpResponse[] results = new SnubaHttpResponse[requests.size()];
        for (int i = 0; i < results.length; i++) {
            results[i] = await(futures.get(i));
        }
        return Arrays.asList(results);
    }

    private SnubaHttpResponse call(SnubaRequest request, WireProtocol protocol, String referrer, String parentApi) {
        String path;
        Map<String, Object> body;
        if (protocol == WireProtocol.LEGACY_JSON) {
            path = LEGACY_PATH;
            body = new LinkedHashMap<>(request.legacyQuery().body());
        } else {
            boolean converted = protocol == WireProtocol.LEGACY_AS_SNQL;
            SnqlQuery query = converted ? LegacySnqlConverter.convert(request.legacyQuery()) : request.snqlQuery();
            path = "/" + query.getDataset() + "/snql";
            body = snqlBody(query, converted);
        }
        body.put("parent_api", parentApi);

        Map<String, String> headers = new LinkedHashMap<>();
        if (referrer != null) {
            headers.put("referer", referrer);
        }
        QueryTags tags = new QueryTags(referrer, parentApi, request.dataset(), path);
        byte[] payload = serialize(body);

        Span span = tracer.spanBuilder("snuba.query")
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute("snuba.referrer", String.valueOf(referrer))
                .setAttribute("snuba.dataset", request.dataset())
                .setAttribute("http.path", path)
                .startSpan();
        long started = System.nanoTime();
        try (Scope ignored = span.makeCurrent()) {
            SnubaHttpResponse response = transport.post(path, payload, headers);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            span.setAttribute("http.status_code", response.status());
            telemetry.recordQuery(tags, response.status(), elapsed);
            log.debug("Snuba query path={} dataset={} status={} elapsedMs={}",
                    path, request.dataset(), response.status(), elapsed.toMillis());
            return response;
        } catch (IOException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            telemetry.recordFailure(tags, e.getClass().getSimpleName());
            throw new SnubaException("Snuba request to " + path + " failed: " + e.getMessage(), e);
        } finally {
            span.end();
        }
    }

    static Map<String, Object> snqlBody(SnqlQuery query, boolean legacy) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dataset", query.getDataset());
        body.put("query", query.toSnql());
        putIfPresent(body, "consistent", query.getConsistent());
        putIfPresent(body, "turbo", query.getTurbo());
        putIfPresent(body, "debug", query.getDebug());
        if (legacy) {
            body.put("legacy", true);
        }
        return body;
    }

    private static void putIfPresent(Map<String, Object> body, String key, Object value) {
        if (value != null) {
            body.put(key, value);
        }
    }

    private static byte[] serialize(Map<String, Object> body) {
        try {
            return JSON.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query body is not serializable", e);
        }
    }

    private static SnubaHttpResponse await(Future<SnubaHttpResponse> future) {
        try {
            return future.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SnubaException("Interrupted while waiting for Snuba", ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new SnubaException("Snuba query failed", cause);
        }
    }

    private static <T> Callable<T> withMdc(Map<String, String> mdc, Callable<T> task) {
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (mdc == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(mdc);
            }
            try {
                return task.call();
            } finally {
                if (previous == null) {
                    MDC.clear();
                } else {
                    MDC.setContextMap(previous);
                }
            }
        };
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "snuba-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        pool.shutdown();
    }
}
