package com.snubalink.client.transport;

import java.nio.charset.StandardCharsets;

/** Status and raw body of one call. */
public record SnubaHttpResponse(int status, byte[] body) {

    public SnubaHttpResponse {
        body = body == null ? new byte[0] : body;
    }

    public static SnubaHttpResponse of(int status, String body) {
        return new SnubaHttpResponse(status, SnubaTransport.requireBytes(body));
    }

    public boolean isOk() {
        return status == 200;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
