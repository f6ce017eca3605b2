package com.snubalink.query.exception;

/** HTTP 429 from the analytics store, whatever the error type in the body. */
public class RateLimitExceededException extends SnubaException {

    public RateLimitExceededException(String message) {
        super(message);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
