package com.snubalink.query.exception;

public class QueryConnectionFailedException extends QueryExecutionException {

    public QueryConnectionFailedException(String message, Integer code) {
        super(message, code);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
