package com.snubalink.query.exception;

public class QueryTooManySimultaneousException extends QueryExecutionException {

    public QueryTooManySimultaneousException(String message, Integer code) {
        super(message, code);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
