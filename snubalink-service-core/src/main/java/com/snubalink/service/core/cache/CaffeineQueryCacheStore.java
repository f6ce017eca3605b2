package com.snubalink.service.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** In-process cache store; every entry expires after the ttl it was written with. */
@Slf4j
public class CaffeineQueryCacheStore implements QueryCacheStore {

    private final Cache<String, Entry> cache;

    public CaffeineQueryCacheStore(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    CaffeineQueryCacheStore(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryTtl())
                .ticker(ticker)
                .build();
        log.info("Initialized query cache maximumSize={}", maximumSize);
    }

    @Override
    public Map<String, String> getMany(Collection<String> keys) {
        Map<String, String> found = new LinkedHashMap<>();
        cache.getAllPresent(keys).forEach((key, entry) -> found.put(key, entry.value()));
        return found;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl.toNanos()));
    }

    private record Entry(String value, long ttlNanos) {}

    private static final class PerEntryTtl implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
