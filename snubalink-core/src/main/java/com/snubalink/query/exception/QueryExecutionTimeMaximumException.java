package com.snubalink.query.exception;

public class QueryExecutionTimeMaximumException extends QueryExecutionException {

    public QueryExecutionTimeMaximumException(String message, Integer code) {
        super(message, code);
    }
}
