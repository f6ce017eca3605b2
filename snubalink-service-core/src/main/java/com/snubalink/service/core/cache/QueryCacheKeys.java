package com.snubalink.service.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.snubalink.service.core.snql.SnqlQuery;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

/** Cache keys for query results: {@code sqc:} followed by the SHA-1 of the canonical query. */
public final class QueryCacheKeys {

    static final String PREFIX = "sqc:";

    private static final ObjectMapper CANONICAL_JSON =
            new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private QueryCacheKeys() {}

    public static String forLegacyBody(Map<String, Object> body) {
        try {
            return PREFIX + sha1(CANONICAL_JSON.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonically encode query body", e);
        }
    }

    public static String forSnql(SnqlQuery query) {
        return PREFIX + sha1(query.getDataset() + ":" + query.toSnql());
    }

    static String sha1(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hashBytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hashBytes.length * 2);
            for (byte b : hashBytes) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    sb.append('0');
                }
                sb.append(hex);
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
