package com.snubalink.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "snubalink.snuba")
public class SnubaProperties {
    private String url = "http://localhost:1218";
    private Http http = new Http();
    private Query query = new Query();
    private Cache cache = new Cache();

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(1);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int maxRetries = 5;
        private Duration retryBackoff = Duration.ZERO;
        private int maxIdleConnections = 10;
        private boolean preferIpv4 = false;

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public int getMaxIdleConnections() {
            return maxIdleConnections;
        }

        public void setMaxIdleConnections(int maxIdleConnections) {
            this.maxIdleConnections = maxIdleConnections;
        }

        public boolean isPreferIpv4() {
            return preferIpv4;
        }

        public void setPreferIpv4(boolean preferIpv4) {
            this.preferIpv4 = preferIpv4;
        }
    }

    public static class Query {
        private int poolSize = 10;
        private boolean useSnql = false;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public boolean isUseSnql() {
            return useSnql;
        }

        public void setUseSnql(boolean useSnql) {
            this.useSnql = useSnql;
        }
    }

    public static class Cache {
        private Duration ttl = Duration.ofSeconds(300);
        private long maximumSize = 10_000;
        private Duration quantizeDuration = Duration.ofSeconds(300);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }

        public Duration getQuantizeDuration() {
            return quantizeDuration;
        }

        public void setQuantizeDuration(Duration quantizeDuration) {
            this.quantizeDuration = quantizeDuration;
        }
    }
}
