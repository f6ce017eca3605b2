package com.snubalink.query.exception;

public class QueryOutsideRetentionException extends QueryWindowException {

    public QueryOutsideRetentionException(String message) {
        super(message);
    }
}
