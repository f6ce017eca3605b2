package com.snubalink.query.exception;

public class QueryMemoryLimitExceededException extends QueryExecutionException {

    public QueryMemoryLimitExceededException(String message, Integer code) {
        super(message, code);
    }
}
