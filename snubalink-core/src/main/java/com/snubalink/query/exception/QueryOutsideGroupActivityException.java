package com.snubalink.query.exception;

/** The window ends before the only queried group was first seen. */
public class QueryOutsideGroupActivityException extends QueryWindowException {

    public QueryOutsideGroupActivityException(String message) {
        super(message);
    }
}
