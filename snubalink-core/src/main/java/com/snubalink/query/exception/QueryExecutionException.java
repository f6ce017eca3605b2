package com.snubalink.query.exception;

/** The backend accepted the query but failed to run it. */
public class QueryExecutionException extends SnubaException {

    private final Integer code;

    public QueryExecutionException(String message) {
        this(message, null);
    }

    public QueryExecutionException(String message, Integer code) {
        super(message);
        this.code = code;
    }

    /** Backend error code, when the error carried one. */
    public Integer getCode() {
        return code;
    }
}
