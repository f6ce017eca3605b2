package com.snubalink.query.exception;

import java.util.Map;
import java.util.function.BiFunction;

/** Maps ClickHouse error codes to the exception that describes them. */
public final class ClickhouseErrors {

    private static final Map<Integer, BiFunction<String, Integer, QueryExecutionException>> BY_CODE = Map.of(
            10, QueryMissingColumnException::new,
            43, QueryIllegalTypeOfArgumentException::new,
            47, QueryMissingColumnException::new,
            62, QuerySizeExceededException::new,
            160, QueryExecutionTimeMaximumException::new,
            202, QueryTooManySimultaneousException::new,
            241, QueryMemoryLimitExceededException::new,
            271, DatasetSelectionException::new,
            279, QueryConnectionFailedException::new);

    private ClickhouseErrors() {}

    /** Unknown or missing codes become a plain {@link QueryExecutionException}. */
    public static QueryExecutionException forCode(Integer code, String message) {
        BiFunction<String, Integer, QueryExecutionException> factory = code == null ? null : BY_CODE.get(code);
        return factory == null ? new QueryExecutionException(message, code) : factory.apply(message, code);
    }
}
