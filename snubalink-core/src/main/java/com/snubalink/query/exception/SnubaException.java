package com.snubalink.query.exception;

/**
 * Base of every error raised while talking to the analytics store. Unchecked; {@link #retryable()}
 * tells callers whether resubmitting the same query may succeed.
 */
public class SnubaException extends RuntimeException {

    public SnubaException(String message) {
        super(message);
    }

    public SnubaException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean retryable() {
        return false;
    }
}
