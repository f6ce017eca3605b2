package com.snubalink.service.core.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snubalink.client.transport.SnubaHttpResponse;
import com.snubalink.query.exception.ClickhouseErrors;
import com.snubalink.query.exception.RateLimitExceededException;
import com.snubalink.query.exception.SchemaValidationException;
import com.snubalink.query.exception.SnubaException;
import com.snubalink.query.exception.UnexpectedResponseException;
import com.snubalink.service.core.translate.SnubaTranslators;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Decodes backend responses. Error bodies become the matching {@link SnubaException}; successful
 * rows are passed through the query's reverse translator.
 */
@Slf4j
public class SnubaResponseParser {

    static final int TOO_MANY_REQUESTS = 429;

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> BODY = new TypeReference<>() {};

    public SnubaResult parse(SnubaHttpResponse response, SnubaTranslators translators) {
        Map<String, Object> body = decode(response);
        if (!response.isOk()) {
            throw toException(response.status(), body);
        }
        List<Map<String, Object>> data = rows(body.get("data"));
        List<Map<String, Object>> meta = rows(body.get("meta"));
        Map<String, Object> totals = body.get("totals") instanceof Map<?, ?> ? castMap(body.get("totals")) : null;
        return new SnubaResult(translators.reverseAll(data), meta, totals);
    }

    /** Cache representation of an already processed result. */
    public String toCacheValue(SnubaResult result) {
        try {
            return JSON.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode query result for the cache", e);
        }
    }

    public SnubaResult fromCacheValue(String value) {
        try {
            return JSON.readValue(value, SnubaResult.class);
        } catch (JsonProcessingException e) {
            throw new UnexpectedResponseException("Cached query result could not be decoded", e);
        }
    }

    private static Map<String, Object> decode(SnubaHttpResponse response) {
        try {
            Map<String, Object> body = JSON.readValue(response.body(), BODY);
            if (body == null) {
                throw new IOException("Empty body");
            }
            return body;
        } catch (IOException e) {
            log.error("Could not decode Snuba response status={} body={}", response.status(), response.bodyAsString());
            throw new UnexpectedResponseException(
                    "Could not decode JSON response (status " + response.status() + "): " + response.bodyAsString(), e);
        }
    }

    static SnubaException toException(int status, Map<String, Object> body) {
        if (!(body.get("error") instanceof Map<?, ?> raw)) {
            return new SnubaException("HTTP " + status);
        }
        Map<?, ?> error = raw;
        String message = error.get("message") == null ? "" : String.valueOf(error.get("message"));
        if (status == TOO_MANY_REQUESTS) {
            return new RateLimitExceededException(message);
        }
        Object type = error.get("type");
        if ("schema".equals(type)) {
            return new SchemaValidationException(message, null);
        }
        if ("clickhouse".equals(type)) {
            Integer code = error.get("code") instanceof Number n ? n.intValue() : null;
            return ClickhouseErrors.forCode(code, message);
        }
        return new SnubaException(message);
    }

    private static List<Map<String, Object>> rows(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        for (Object row : list) {
            if (!(row instanceof Map<?, ?>)) {
                throw new UnexpectedResponseException("Unexpected row in response: " + row, null);
            }
        }
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rows = (List<Map<String, Object>>) list;
        return rows;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object raw) {
        return (Map<String, Object>) raw;
    }
}
