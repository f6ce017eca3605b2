package com.snubalink.client.transport.okhttp;

import com.snubalink.client.transport.SnubaHttpResponse;
import com.snubalink.client.transport.SnubaTransport;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.ConnectionPool;
import okhttp3.Dns;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based transport with a shared connection pool and a retry budget for connection failures. */
public class OkHttpSnubaTransport implements SnubaTransport {
    private static final Logger log = LoggerFactory.getLogger(OkHttpSnubaTransport.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final String baseUrl;
    private final OkHttpClient client;

    private OkHttpSnubaTransport(Builder b) {
        this.baseUrl = b.baseUrl;
        this.client = new OkHttpClient.Builder()
                .dns(b.preferIpv4 ? new Ipv4FirstDns(Dns.SYSTEM) : Dns.SYSTEM)
                .connectTimeout(b.connectTimeout)
                .readTimeout(b.readTimeout)
                .connectionPool(new ConnectionPool(b.maxIdleConnections, 5, TimeUnit.MINUTES))
                // retries are owned by the interceptor so that read timeouts are never replayed
                .retryOnConnectionFailure(false)
                .addInterceptor(new RetrySkipTimeoutInterceptor(b.maxRetries, b.retryBackoff))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String baseUrl() {
        return baseUrl != null ? baseUrl : SnubaTransport.super.baseUrl();
    }

    @Override
    public SnubaHttpResponse post(String path, byte[] body, Map<String, String> headers) throws IOException {
        Request.Builder req = new Request.Builder().url(resolve(path).toString()).post(RequestBody.create(body, JSON));
        headers.forEach(req::header);
        Request request = req.build();
        if (log.isDebugEnabled()) {
            log.debug("Sending {} {} ({} bytes)", request.method(), request.url(), body.length);
        }
        try (Response r = client.newCall(request).execute()) {
            ResponseBody responseBody = r.body();
            byte[] bytes = responseBody != null ? responseBody.bytes() : new byte[0];
            if (log.isDebugEnabled()) {
                log.debug("{} {} answered {} ({} bytes)", request.method(), request.url(), r.code(), bytes.length);
            }
            return new SnubaHttpResponse(r.code(), bytes);
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    public static final class Builder {
        private String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(1);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int maxRetries = 5;
        private Duration retryBackoff = Duration.ZERO;
        private int maxIdleConnections = 10;
        private boolean preferIpv4;

        public Builder baseUrl(String v) {
            this.baseUrl = v;
            return this;
        }

        public Builder connectTimeout(Duration v) {
            this.connectTimeout = v;
            return this;
        }

        public Builder readTimeout(Duration v) {
            this.readTimeout = v;
            return this;
        }

        public Builder maxRetries(int v) {
            this.maxRetries = v;
            return this;
        }

        public Builder retryBackoff(Duration v) {
            this.retryBackoff = v;
            return this;
        }

        public Builder maxIdleConnections(int v) {
            this.maxIdleConnections = v;
            return this;
        }

        /** Try IPv4 addresses before IPv6 ones, for hosts whose IPv6 route is unreliable. */
        public Builder preferIpv4(boolean v) {
            this.preferIpv4 = v;
            return this;
        }

        public OkHttpSnubaTransport build() {
            return new OkHttpSnubaTransport(this);
        }
    }
}
