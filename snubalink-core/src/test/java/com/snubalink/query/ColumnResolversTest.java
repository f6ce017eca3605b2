package com.snubalink.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ColumnResolversTest {

    private final ColumnResolver events = ColumnResolvers.forDataset(Dataset.EVENTS);
    private final ColumnResolver transactions = ColumnResolvers.forDataset(Dataset.TRANSACTIONS);
    private final ColumnResolver discover = ColumnResolvers.forDataset(Dataset.DISCOVER);

    @Test
    void mapsPublicNamesThroughAliasTable() {
        assertThat(events.resolve("release")).isEqualTo("tags[sentry:release]");
        assertThat(events.resolve("issue.id")).isEqualTo("group_id");
        assertThat(events.resolve("user.email")).isEqualTo("email");
        assertThat(transactions.resolve("transaction")).isEqualTo("transaction_name");
        assertThat(transactions.resolve("timestamp")).isEqualTo("finish_ts");
    }

    @Test
    void unknownNamesBecomeTags() {
        assertThat(events.resolve("browser.name")).isEqualTo("tags[browser.name]");
        assertThat(events.resolve("foo")).isEqualTo("tags[foo]");
    }

    @Test
    void taggedAndQuotedNamesPassThrough() {
        assertThat(events.resolve("tags[foo]")).isEqualTo("tags[foo]");
        assertThat(events.resolve("'literal'")).isEqualTo("'literal'");
    }

    @Test
    void nativeColumnsPassThrough() {
        assertThat(events.resolve("group_id")).isEqualTo("group_id");
        assertThat(events.resolve("project_id")).isEqualTo("project_id");
        assertThat(transactions.resolve("project_id")).isEqualTo("project_id");
        assertThat(discover.resolve("project_id")).isEqualTo("project_id");
    }

    @Test
    void tagsNamedLikePhysicalColumnsStayTags() {
        assertThat(transactions.resolve("duration")).isEqualTo("tags[duration]");
        assertThat(transactions.resolve("user_id")).isEqualTo("tags[user_id]");
        assertThat(events.resolve("email")).isEqualTo("tags[email]");
        assertThat(events.resolve("event_id")).isEqualTo("tags[event_id]");
    }

    @Test
    void nestedColumnNamesStillRewriteAsMeasurementsAndBreakdowns() {
        assertThat(transactions.resolve("spans.op")).isEqualTo("span_op_breakdowns[ops.op]");
        assertThat(transactions.resolve("spans.exclusive_time")).isEqualTo("span_op_breakdowns[ops.exclusive_time]");
        assertThat(transactions.resolve("measurements.value")).isEqualTo("measurements[value]");
        assertThat(transactions.resolve("measurements.key")).isEqualTo("measurements[key]");
    }

    @Test
    void rewritesMeasurementsAndSpanOpBreakdownsWhereSupported() {
        assertThat(transactions.resolve("measurements.LCP")).isEqualTo("measurements[lcp]");
        assertThat(discover.resolve("measurements.fp")).isEqualTo("measurements[fp]");
        assertThat(transactions.resolve("spans.http")).isEqualTo("span_op_breakdowns[ops.http]");
        assertThat(events.resolve("measurements.lcp")).isEqualTo("tags[measurements.lcp]");
    }

    @Test
    void valuesThatAreNotNamesAreUntouched() {
        assertThat(events.resolveValue(null)).isNull();
        assertThat(events.resolveValue(42)).isEqualTo(42);
        assertThat(events.resolveValue(1.5d)).isEqualTo(1.5d);
        assertThat(events.resolveValue(List.of("a", "b"))).isEqualTo(List.of("a", "b"));
        assertThat(events.resolveValue("release")).isEqualTo("tags[sentry:release]");
    }

    @ParameterizedTest
    @EnumSource(Dataset.class)
    void resolutionIsDeterministic(Dataset dataset) {
        ColumnResolver resolver = ColumnResolvers.forDataset(dataset);
        for (String name : List.of("release", "environment", "timestamp", "foo", "measurements.lcp", "spans.db")) {
            assertThat(resolver.resolve(name)).as("%s on %s", name, dataset).isEqualTo(resolver.resolve(name));
        }
    }

    @Test
    void rewrittenMeasurementsAndBreakdownsPassThrough() {
        assertThat(transactions.resolve("measurements[lcp]")).isEqualTo("measurements[lcp]");
        assertThat(transactions.resolve("span_op_breakdowns[ops.http]")).isEqualTo("span_op_breakdowns[ops.http]");
    }

    @Test
    void datasetValuesRoundTrip() {
        assertThat(Dataset.fromValue("outcomes_raw")).isEqualTo(Dataset.OUTCOMES_RAW);
        assertThat(Dataset.SESSIONS.organizationStrategy())
                .isEqualTo(Dataset.OrganizationStrategy.PROJECTS_WITH_ORGANIZATION);
        assertThat(Dataset.TRANSACTIONS.supportsMeasurements()).isTrue();
        assertThat(Dataset.EVENTS.supportsMeasurements()).isFalse();
    }
}
