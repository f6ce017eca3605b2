package com.snubalink.query.exception;

/** The query cannot be tied to exactly one organization. */
public class UnqualifiedQueryException extends SnubaException {

    public UnqualifiedQueryException(String message) {
        super(message);
    }
}
