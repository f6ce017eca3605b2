package com.snubalink.query.exception;

/** The query could not be routed to a storage. */
public class DatasetSelectionException extends QueryExecutionException {

    public DatasetSelectionException(String message, Integer code) {
        super(message, code);
    }
}
