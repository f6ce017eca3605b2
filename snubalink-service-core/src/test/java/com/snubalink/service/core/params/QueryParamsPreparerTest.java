package com.snubalink.service.core.params;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.snubalink.query.Dataset;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.query.condition.Condition;
import com.snubalink.query.condition.Operator;
import com.snubalink.query.exception.QueryOutsideGroupActivityException;
import com.snubalink.query.exception.QueryOutsideRetentionException;
import com.snubalink.service.core.lookup.InMemoryEntityLookup;
import com.snubalink.service.core.options.QueryOptionOverrides;
import com.snubalink.service.core.translate.SnubaTranslatorFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryParamsPreparerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private InMemoryEntityLookup lookup;
    private QueryOptionOverrides overrides;
    private QueryParamsPreparer preparer;

    @BeforeEach
    void setUp() {
        lookup = new InMemoryEntityLookup()
                .organization(7, 90)
                .project(1, 7)
                .environment(3, "")
                .environment(4, "production")
                .release(5, "1.0.0", 1L)
                .group(100, 1, Instant.parse("2024-05-01T12:00:00Z"))
                .group(101, 1, Instant.parse("2024-05-20T00:00:00Z"));
        overrides = new QueryOptionOverrides();
        preparer = new QueryParamsPreparer(
                new SnubaTranslatorFactory(lookup),
                new OrganizationResolver(lookup),
                lookup,
                overrides,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private SnubaQueryParams.Builder lastWeek() {
        return SnubaQueryParams.builder(Dataset.EVENTS)
                .start(Instant.parse("2024-05-25T00:00:00Z"))
                .end(Instant.parse("2024-06-01T00:00:00Z"))
                .filter("project_id", List.of(1));
    }

    @Test
    void buildsLegacyBody() {
        SnubaQueryParams params = lastWeek()
                .groupby("issue")
                .aggregation("count()", null, "count")
                .condition(Condition.of("type", Operator.EQ, "error"))
                .limit(10)
                .build();

        Map<String, Object> body = preparer.prepare(params).body();

        assertThat(body.keySet())
                .containsExactly(
                        "dataset",
                        "from_date",
                        "to_date",
                        "groupby",
                        "conditions",
                        "aggregations",
                        "limit",
                        "project");
        assertThat(body)
                .containsEntry("dataset", "events")
                .containsEntry("from_date", "2024-05-25T00:00:00")
                .containsEntry("to_date", "2024-06-01T00:00:00")
                .containsEntry("groupby", List.of("issue"))
                .containsEntry("aggregations", List.of(List.of("count()", "", "count")))
                .containsEntry("project", List.of(1L));
        assertThat((List<Object>) body.get("conditions"))
                .containsExactly(List.of("type", "=", "error"), List.of("project_id", "IN", List.of(1)));
    }

    @Test
    void sendsTotalsOnlyWhenRequested() {
        assertThat(preparer.prepare(lastWeek().build()).body()).doesNotContainKey("totals");
        assertThat(preparer.prepare(lastWeek().totals(true).build()).body()).containsEntry("totals", true);
    }

    @Test
    void clampsStartToRetention() {
        SnubaQueryParams params = lastWeek().start(Instant.parse("2020-01-01T00:00:00Z")).build();

        PreparedQuery prepared = preparer.prepare(params);

        assertThat(prepared.start()).isEqualTo(Instant.parse("2024-03-03T00:00:00Z"));
        assertThat(prepared.body()).containsEntry("from_date", "2024-03-03T00:00:00");
    }

    @Test
    void windowOlderThanRetentionIsRejected() {
        SnubaQueryParams params = lastWeek()
                .start(Instant.parse("2023-01-01T00:00:00Z"))
                .end(Instant.parse("2023-02-01T00:00:00Z"))
                .build();

        assertThatThrownBy(() -> preparer.prepare(params))
                .isInstanceOf(QueryOutsideRetentionException.class)
                .hasMessage("Invalid date range. Please try a more recent date range.");
    }

    @Test
    void missingBoundsDefaultToRetentionAndNow() {
        SnubaQueryParams params = SnubaQueryParams.builder(Dataset.EVENTS)
                .filter("project_id", List.of(1))
                .build();

        PreparedQuery prepared = preparer.prepare(params);

        assertThat(prepared.start()).isEqualTo(Instant.parse("2024-03-03T00:00:00Z"));
        assertThat(prepared.end()).isEqualTo(NOW.plusSeconds(1));
    }

    @Test
    void singleGroupNarrowsStartToFirstSeen() {
        SnubaQueryParams params = lastWeek()
                .start(Instant.parse("2024-04-01T00:00:00Z"))
                .filter("group_id", List.of(100))
                .build();

        assertThat(preparer.prepare(params).start()).isEqualTo(Instant.parse("2024-05-01T11:55:00Z"));
    }

    @Test
    void singleGroupNeverWidensTheWindow() {
        SnubaQueryParams params = lastWeek().filter("group_id", List.of(100)).build();

        assertThat(preparer.prepare(params).start()).isEqualTo(Instant.parse("2024-05-25T00:00:00Z"));
    }

    @Test
    void severalGroupsLeaveTheWindowAlone() {
        SnubaQueryParams params = lastWeek()
                .start(Instant.parse("2024-04-01T00:00:00Z"))
                .filter("group_id", List.of(100, 101))
                .build();

        assertThat(preparer.prepare(params).start()).isEqualTo(Instant.parse("2024-04-01T00:00:00Z"));
    }

    @Test
    void windowBeforeGroupActivityIsRejected() {
        SnubaQueryParams params = lastWeek()
                .start(Instant.parse("2024-04-01T00:00:00Z"))
                .end(Instant.parse("2024-04-15T00:00:00Z"))
                .filter("group_id", List.of(101))
                .build();

        assertThatThrownBy(() -> preparer.prepare(params)).isInstanceOf(QueryOutsideGroupActivityException.class);
    }

    @Test
    void emptyEnvironmentNameBecomesIsNull() {
        SnubaQueryParams params = lastWeek().filter("environment", List.of(3)).build();

        List<Object> conditions = (List<Object>) preparer.prepare(params).body().get("conditions");

        assertThat(conditions).contains(Arrays.asList("environment", "IS NULL", null));
    }

    @Test
    void environmentIdsAreSentAsNames() {
        SnubaQueryParams params = lastWeek().filter("environment", List.of(4)).build();

        List<Object> conditions = (List<Object>) preparer.prepare(params).body().get("conditions");

        assertThat(conditions).contains(List.of("environment", "IN", List.of("production")));
    }

    @Test
    void releaseFilterIsDroppedWhenNoIdTranslates() {
        SnubaQueryParams params = lastWeek().filter("tags[sentry:release]", List.of(999)).build();

        List<Object> conditions = (List<Object>) preparer.prepare(params).body().get("conditions");

        assertThat(conditions)
                .noneMatch(c -> c instanceof List<?> l && !l.isEmpty() && "tags[sentry:release]".equals(l.get(0)));
    }

    @Test
    void releaseFilterKeepsOnlyTheIdsThatTranslate() {
        SnubaQueryParams params = lastWeek().filter("tags[sentry:release]", List.of(999, 5)).build();

        List<Object> conditions = (List<Object>) preparer.prepare(params).body().get("conditions");

        assertThat(conditions).contains(List.of("tags[sentry:release]", "IN", List.of("1.0.0")));
    }

    @Test
    void mergesActiveOptionOverrides() {
        try (QueryOptionOverrides.Scope ignored = overrides.override(Map.of("consistent", true))) {
            assertThat(preparer.prepare(lastWeek().build()).body()).containsEntry("consistent", true);
        }
        assertThat(preparer.prepare(lastWeek().build()).body()).doesNotContainKey("consistent");
    }

    @Test
    void keepsTypedConditionsForConversion() {
        SnubaQueryParams params = lastWeek().condition(Condition.of("type", Operator.EQ, "error")).build();

        PreparedQuery prepared = preparer.prepare(params);

        assertThat(prepared.conditions())
                .containsExactly(Condition.of("type", Operator.EQ, "error"), Condition.in("project_id", List.of(1)));
        assertThat(prepared.scope().organizationId()).isEqualTo(7);
    }
}
