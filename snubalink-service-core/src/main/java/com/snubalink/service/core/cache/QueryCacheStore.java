package com.snubalink.service.core.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/** Key-value store for serialized query results. */
public interface QueryCacheStore {

    /** Values of the keys present in the store. Missing or expired keys are absent from the map. */
    Map<String, String> getMany(Collection<String> keys);

    void set(String key, String value, Duration ttl);
}
