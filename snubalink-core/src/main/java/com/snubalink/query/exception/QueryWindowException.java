package com.snubalink.query.exception;

/**
 * The requested time window is empty once retention or group activity is taken into account.
 * Callers usually answer such a query with an empty result instead of failing.
 */
public abstract class QueryWindowException extends RuntimeException {

    protected QueryWindowException(String message) {
        super(message);
    }
}
