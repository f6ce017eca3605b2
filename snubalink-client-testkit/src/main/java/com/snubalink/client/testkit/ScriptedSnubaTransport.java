package com.snubalink.client.testkit;

import com.snubalink.client.transport.SnubaHttpResponse;
import com.snubalink.client.transport.SnubaTransport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double that records every call and answers from a script: queued responses first, then the
 * responder. Safe to call from several threads.
 */
public class ScriptedSnubaTransport implements SnubaTransport {
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Queue<SnubaHttpResponse> queued = new ConcurrentLinkedQueue<>();
    private volatile Responder responder = call -> SnubaHttpResponse.of(200, "{\"data\":[],\"meta\":[]}");

    /** Computes the answer to a call; may block to simulate latency or throw to simulate a broken connection. */
    @FunctionalInterface
    public interface Responder {
        SnubaHttpResponse respond(Call call) throws IOException;
    }

    /** One recorded call. */
    public record Call(String path, byte[] body, Map<String, String> headers) {
        public String bodyAsString() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }

    public ScriptedSnubaTransport enqueue(int status, String body) {
        queued.add(SnubaHttpResponse.of(status, body));
        return this;
    }

    public ScriptedSnubaTransport respondWith(Responder responder) {
        this.responder = responder;
        return this;
    }

    @Override
    public SnubaHttpResponse post(String path, byte[] body, Map<String, String> headers) throws IOException {
        Call call = new Call(path, body.clone(), Map.copyOf(headers));
        calls.add(call);
        SnubaHttpResponse next = queued.poll();
        return next != null ? next : responder.respond(call);
    }

    @Override
    public String baseUrl() {
        return "http://snuba.test";
    }

    public List<Call> calls() {
        return Collections.unmodifiableList(new ArrayList<>(calls));
    }

    public Call lastCall() {
        if (calls.isEmpty()) throw new IllegalStateException("No calls recorded");
        return calls.get(calls.size() - 1);
    }

    public void clear() {
        calls.clear();
        queued.clear();
    }
}
