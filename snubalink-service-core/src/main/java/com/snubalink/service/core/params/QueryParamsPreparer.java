package com.snubalink.service.core.params;

import com.snubalink.query.Aggregation;
import com.snubalink.query.IsoTimes;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.query.condition.Condition;
import com.snubalink.query.condition.PositionalConditions;
import com.snubalink.query.exception.QueryOutsideGroupActivityException;
import com.snubalink.query.exception.QueryOutsideRetentionException;
import com.snubalink.service.core.lookup.EntityLookupService;
import com.snubalink.service.core.lookup.EntityLookupService.GroupRef;
import com.snubalink.service.core.lookup.EntityLookupService.OrganizationRef;
import com.snubalink.service.core.lookup.LookupIds;
import com.snubalink.service.core.options.QueryOptionOverrides;
import com.snubalink.service.core.translate.SnubaTranslatorFactory;
import com.snubalink.service.core.translate.SnubaTranslators;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a logical query into the request the backend understands: builds the translators, ties the
 * query to an organization, turns filter keys into conditions and narrows the time window.
 */
@Slf4j
@RequiredArgsConstructor
public class QueryParamsPreparer {

    /** Slack kept before a group's first event when narrowing a single-group query. */
    static final Duration GROUP_FIRST_SEEN_SLACK = Duration.ofMinutes(5);

    private final SnubaTranslatorFactory translatorFactory;
    private final OrganizationResolver organizationResolver;
    private final EntityLookupService lookup;
    private final QueryOptionOverrides optionOverrides;
    private final Clock clock;

    public PreparedQuery prepare(SnubaQueryParams params) {
        Instant now = clock.instant();
        Instant start = params.getStart() != null ? params.getStart() : Instant.EPOCH;
        Instant end = params.getEnd() != null ? params.getEnd() : now.plusSeconds(1);

        SnubaTranslators translators = translatorFactory.build(params);
        OrganizationScope scope = organizationResolver.resolve(params);

        List<Condition> conditions = new ArrayList<>(params.getConditions());
        Map<String, List<Object>> forwarded = translators.forward(params.getFilterKeys());
        forwarded.forEach((column, values) -> {
            List<Object> original = params.getFilterKeys().get(column);
            // keys whose ids all failed translation are dropped
            if (original == null || original.isEmpty() || values.isEmpty()) {
                return;
            }
            if (values.size() == 1 && values.get(0) == null) {
                conditions.add(Condition.isNull(column));
            } else {
                conditions.add(Condition.in(column, values));
            }
        });

        Integer retentionDays = lookup.organization(scope.organizationId())
                .map(OrganizationRef::retentionDays)
                .orElse(null);
        if (retentionDays != null && retentionDays > 0) {
            Instant retentionStart = now.minus(Duration.ofDays(retentionDays));
            if (start.isBefore(retentionStart)) {
                start = retentionStart;
            }
            if (start.isAfter(end)) {
                throw new QueryOutsideRetentionException("Invalid date range. Please try a more recent date range.");
            }
        }

        List<Long> groupIds = LookupIds.distinct(params.getFilterKeys().get(OrganizationResolver.GROUP_ID));
        if (groupIds.size() == 1) {
            Optional<Instant> firstSeen = lookup.group(groupIds.get(0)).map(GroupRef::firstSeen);
            if (firstSeen.isPresent()) {
                Instant shrunk = firstSeen.get().minus(GROUP_FIRST_SEEN_SLACK);
                if (shrunk.isAfter(start)) {
                    log.debug("Narrowing start of single-group query from {} to {}", start, shrunk);
                    start = shrunk;
                }
            }
            if (start.isAfter(end)) {
                throw new QueryOutsideGroupActivityException(
                        "Query window ends before group " + groupIds.get(0) + " was first seen");
            }
        }

        Map<String, Object> body = body(params, conditions, scope, start, end);
        body.putAll(optionOverrides.current());
        return new PreparedQuery(params, body, translators, scope, conditions, start, end);
    }

    private static Map<String, Object> body(
            SnubaQueryParams params, List<Condition> conditions, OrganizationScope scope, Instant start, Instant end) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dataset", params.getDataset().value());
        body.put("from_date", IsoTimes.formatNaive(start));
        body.put("to_date", IsoTimes.formatNaive(end));
        body.put("groupby", new ArrayList<>(params.getGroupby()));
        body.put("conditions", PositionalConditions.renderAll(conditions));
        List<Object> aggregations = new ArrayList<>();
        for (Aggregation aggregation : params.getAggregations()) {
            aggregations.add(aggregation.toPositional());
        }
        body.put("aggregations", aggregations);
        body.put("granularity", params.getRollup());
        if (!params.getSelectedColumns().isEmpty()) {
            List<Object> selected = new ArrayList<>();
            params.getSelectedColumns().forEach(column -> selected.add(PositionalConditions.render(column)));
            body.put("selected_columns", selected);
        }
        if (!params.getHaving().isEmpty()) {
            body.put("having", PositionalConditions.renderAll(params.getHaving()));
        }
        if (!params.getOrderby().isEmpty()) {
            body.put("orderby", new ArrayList<>(params.getOrderby()));
        }
        body.put("limit", params.getLimit());
        body.put("offset", params.getOffset());
        body.put("totals", params.isTotals() ? Boolean.TRUE : null);
        body.put("turbo", params.getTurbo());
        body.put("consistent", params.getConsistent());
        body.put("debug", params.getDebug());
        body.put("sample", params.getSample());
        body.put("arrayjoin", params.getArrayjoin());
        body.putAll(scope.bodyFields());
        body.values().removeIf(value -> value == null);
        return body;
    }
}
