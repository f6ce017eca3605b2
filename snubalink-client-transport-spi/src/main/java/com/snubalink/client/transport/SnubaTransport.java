package com.snubalink.client.transport;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal transport SPI: POST a serialized query to the analytics store and hand back the raw
 * status and body. Status codes are not interpreted here.
 */
public interface SnubaTransport extends Closeable {
    String DEFAULT_SCHEME = "http";
    String DEFAULT_HOST = "localhost";
    int DEFAULT_PORT = 1218;
    String DEFAULT_URL = DEFAULT_SCHEME + "://" + DEFAULT_HOST + ":" + DEFAULT_PORT;
    String PROP_URL = "snubalink.snuba.url";
    String ENV_URL = "SNUBA_URL";

    /**
     * @param path absolute path below {@link #baseUrl()}, e.g. {@code /query} or {@code /events/snql}
     * @throws IOException when no response could be obtained, after any retries the transport does
     */
    SnubaHttpResponse post(String path, byte[] body, Map<String, String> headers) throws IOException;

    default String baseUrl() {
        String sys = System.getProperty(PROP_URL);
        if (sys != null && !sys.isBlank()) return sys;
        String env = System.getenv(ENV_URL);
        if (env != null && !env.isBlank()) return env;
        return DEFAULT_URL;
    }

    default URI resolve(String path) {
        String base = baseUrl();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return URI.create(base + (path.startsWith("/") ? path : "/" + path));
    }

    @Override
    default void close() throws IOException {
        /* no-op */
    }

    static byte[] requireBytes(String s) {
        return Objects.requireNonNull(s, "payload").getBytes(StandardCharsets.UTF_8);
    }
}
