package com.snubalink.query.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ClickhouseErrorsTest {

    @Test
    void mapsKnownCodes() {
        assertThat(ClickhouseErrors.forCode(10, "m")).isInstanceOf(QueryMissingColumnException.class);
        assertThat(ClickhouseErrors.forCode(47, "m")).isInstanceOf(QueryMissingColumnException.class);
        assertThat(ClickhouseErrors.forCode(43, "m")).isInstanceOf(QueryIllegalTypeOfArgumentException.class);
        assertThat(ClickhouseErrors.forCode(62, "m")).isInstanceOf(QuerySizeExceededException.class);
        assertThat(ClickhouseErrors.forCode(160, "m")).isInstanceOf(QueryExecutionTimeMaximumException.class);
        assertThat(ClickhouseErrors.forCode(202, "m")).isInstanceOf(QueryTooManySimultaneousException.class);
        assertThat(ClickhouseErrors.forCode(241, "m")).isInstanceOf(QueryMemoryLimitExceededException.class);
        assertThat(ClickhouseErrors.forCode(271, "m")).isInstanceOf(DatasetSelectionException.class);
        assertThat(ClickhouseErrors.forCode(279, "m")).isInstanceOf(QueryConnectionFailedException.class);
    }

    @Test
    void unknownCodesAreGenericExecutionErrors() {
        QueryExecutionException error = ClickhouseErrors.forCode(999, "boom");

        assertThat(error.getClass()).isEqualTo(QueryExecutionException.class);
        assertThat(error.getCode()).isEqualTo(999);
        assertThat(error.getMessage()).isEqualTo("boom");
        assertThat(ClickhouseErrors.forCode(null, "x").getClass()).isEqualTo(QueryExecutionException.class);
    }

    @Test
    void onlyTransientFailuresAreRetryable() {
        assertThat(ClickhouseErrors.forCode(202, "m").retryable()).isTrue();
        assertThat(ClickhouseErrors.forCode(279, "m").retryable()).isTrue();
        assertThat(ClickhouseErrors.forCode(241, "m").retryable()).isFalse();
        assertThat(new RateLimitExceededException("slow down").retryable()).isTrue();
        assertThat(new UnqualifiedQueryException("no org").retryable()).isFalse();
    }
}
