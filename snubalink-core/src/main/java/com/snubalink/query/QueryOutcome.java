package com.snubalink.query;

import com.snubalink.query.exception.SnubaException;
import java.util.Objects;

/**
 * Result of a query that does not throw: the result, an empty window (retention or group activity
 * ruled the whole range out), or a backend failure.
 */
public sealed interface QueryOutcome<T> permits QueryOutcome.Success, QueryOutcome.EmptyWindow, QueryOutcome.Failure {

    static <T> QueryOutcome<T> success(T result) {
        return new Success<>(result);
    }

    static <T> QueryOutcome<T> emptyWindow(String reason) {
        return new EmptyWindow<>(reason);
    }

    static <T> QueryOutcome<T> failure(SnubaException error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success<?>;
    }

    record Success<T>(T result) implements QueryOutcome<T> {
        public Success {
            Objects.requireNonNull(result, "result");
        }
    }

    record EmptyWindow<T>(String reason) implements QueryOutcome<T> {}

    record Failure<T>(SnubaException error) implements QueryOutcome<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        public boolean retryable() {
            return error.retryable();
        }
    }
}
