package com.snubalink.query.exception;

/** The query body was rejected by the backend schema. */
public class SchemaValidationException extends QueryExecutionException {

    public SchemaValidationException(String message, Integer code) {
        super(message, code);
    }
}
