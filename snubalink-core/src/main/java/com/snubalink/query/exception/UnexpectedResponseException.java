package com.snubalink.query.exception;

/** The response body could not be decoded. */
public class UnexpectedResponseException extends SnubaException {

    public UnexpectedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
