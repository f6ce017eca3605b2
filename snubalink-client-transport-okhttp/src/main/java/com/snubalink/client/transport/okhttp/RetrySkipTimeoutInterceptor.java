package com.snubalink.client.transport.okhttp;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries calls that failed before a response arrived, up to a fixed budget. A read timeout is
 * rethrown at once: the query may still be running on the backend and resubmitting it only adds
 * load.
 */
public class RetrySkipTimeoutInterceptor implements Interceptor {
    private static final Logger log = LoggerFactory.getLogger(RetrySkipTimeoutInterceptor.class);
    private static final Set<String> RETRYABLE_METHODS = Set.of("GET", "POST", "DELETE");

    private final int maxRetries;
    private final Duration backoff;

    public RetrySkipTimeoutInterceptor(int maxRetries, Duration backoff) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
        this.backoff = backoff == null ? Duration.ZERO : backoff;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        if (!RETRYABLE_METHODS.contains(request.method())) {
            return chain.proceed(request);
        }
        for (int attempt = 0; ; attempt++) {
            try {
                return chain.proceed(request);
            } catch (IOException e) {
                if (isReadTimeout(e) || attempt >= maxRetries) {
                    throw e;
                }
                log.warn(
                        "Request {} {} failed ({}), retry {}/{}",
                        request.method(),
                        request.url().encodedPath(),
                        e.toString(),
                        attempt + 1,
                        maxRetries);
                pause(attempt);
            }
        }
    }

    static boolean isReadTimeout(IOException e) {
        if (!(e instanceof SocketTimeoutException)) return false;
        String message = e.getMessage();
        return message == null || !message.toLowerCase(Locale.ROOT).contains("connect");
    }

    private void pause(int attempt) throws InterruptedIOException {
        if (backoff.isZero()) return;
        long millis = backoff.toMillis() << Math.min(attempt, 10);
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while backing off");
            interrupted.initCause(e);
            throw interrupted;
        }
    }
}
