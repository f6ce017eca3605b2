package com.snubalink.service.core.snql;

import static org.assertj.core.api.Assertions.assertThat;

import com.snubalink.query.Dataset;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.query.condition.Condition;
import com.snubalink.query.condition.Operator;
import com.snubalink.service.core.params.OrganizationScope;
import com.snubalink.service.core.params.PreparedQuery;
import com.snubalink.service.core.translate.SnubaTranslators;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LegacySnqlConverterTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-02T00:00:00Z");

    @Test
    void convertsProjectQueryOnTheDatasetTimestamp() {
        SnubaQueryParams params = SnubaQueryParams.builder(Dataset.TRANSACTIONS)
                .groupby("transaction")
                .aggregation("quantiles(0.5)", "duration", "p50")
                .orderby("-p50")
                .limit(5)
                .rollup(3600)
                .build();
        PreparedQuery prepared = new PreparedQuery(
                params,
                Map.of(),
                SnubaTranslators.identity(),
                new OrganizationScope(7, List.of(1L, 2L), false),
                List.of(Condition.of("transaction_op", Operator.EQ, "http.server")),
                START,
                END);

        SnqlQuery query = LegacySnqlConverter.convert(prepared);

        assertThat(query.getDataset()).isEqualTo("transactions");
        assertThat(query.toSnql())
                .isEqualTo("MATCH (transactions) SELECT quantiles(0.5)(duration) AS `p50` BY transaction"
                        + " WHERE finish_ts >= toDateTime('2024-01-01T00:00:00')"
                        + " AND finish_ts < toDateTime('2024-01-02T00:00:00')"
                        + " AND project_id IN tuple(1, 2)"
                        + " AND transaction_op = 'http.server'"
                        + " ORDER BY p50 DESC LIMIT 5 GRANULARITY 3600");
    }

    @Test
    void organizationDatasetsFilterOnOrgId() {
        SnubaQueryParams params = SnubaQueryParams.builder(Dataset.OUTCOMES)
                .aggregation("sum", "quantity", "total")
                .totals(true)
                .consistent(true)
                .build();
        PreparedQuery prepared = new PreparedQuery(
                params, Map.of(), SnubaTranslators.identity(), new OrganizationScope(7, List.of(), true), List.of(), START, END);

        SnqlQuery query = LegacySnqlConverter.convert(prepared);

        assertThat(query.toSnql())
                .isEqualTo("MATCH (outcomes) SELECT sum(quantity) AS `total`"
                        + " WHERE timestamp >= toDateTime('2024-01-01T00:00:00')"
                        + " AND timestamp < toDateTime('2024-01-02T00:00:00')"
                        + " AND org_id = 7 TOTALS True");
        assertThat(query.getConsistent()).isTrue();
    }
}
