package com.snubalink.query.exception;

/** The generated SQL exceeded the maximum query size. */
public class QuerySizeExceededException extends QueryExecutionException {

    public QuerySizeExceededException(String message, Integer code) {
        super(message, code);
    }
}
