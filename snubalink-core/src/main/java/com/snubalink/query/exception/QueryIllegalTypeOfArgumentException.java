package com.snubalink.query.exception;

public class QueryIllegalTypeOfArgumentException extends QueryExecutionException {

    public QueryIllegalTypeOfArgumentException(String message, Integer code) {
        super(message, code);
    }
}
