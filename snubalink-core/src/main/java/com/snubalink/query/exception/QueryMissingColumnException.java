package com.snubalink.query.exception;

/** A referenced column does not exist. */
public class QueryMissingColumnException extends QueryExecutionException {

    public QueryMissingColumnException(String message, Integer code) {
        super(message, code);
    }
}
