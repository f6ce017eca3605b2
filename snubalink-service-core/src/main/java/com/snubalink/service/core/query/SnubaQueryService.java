package com.snubalink.service.core.query;

import com.snubalink.client.transport.SnubaHttpResponse;
import com.snubalink.query.Aggregation;
import com.snubalink.query.AliasResolver;
import com.snubalink.query.ColumnResolvers;
import com.snubalink.query.QueryOutcome;
import com.snubalink.query.ResolvedQuery;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.query.exception.QueryWindowException;
import com.snubalink.query.exception.SnubaException;
import com.snubalink.query.result.ResultNesting;
import com.snubalink.query.result.Zerofill;
import com.snubalink.service.core.cache.QueryCacheKeys;
import com.snubalink.service.core.cache.QueryCacheStore;
import com.snubalink.service.core.dispatch.SnubaDispatcher;
import com.snubalink.service.core.dispatch.SnubaRequest;
import com.snubalink.service.core.params.PreparedQuery;
import com.snubalink.service.core.params.QueryParamsPreparer;
import com.snubalink.service.core.response.SnubaResponseParser;
import com.snubalink.service.core.response.SnubaResult;
import com.snubalink.service.core.snql.SnqlQuery;
import com.snubalink.service.core.telemetry.SnubaTelemetry;
import com.snubalink.service.core.translate.SnubaTranslators;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for running queries: prepares them, serves what it can from the cache, dispatches
 * the rest and decodes the responses.
 */
@Slf4j
public class SnubaQueryService {

    /** Alias of the aggregation added to queries that declare none. */
    public static final String DEFAULT_AGGREGATE = "aggregate";

    private final QueryParamsPreparer preparer;
    private final SnubaDispatcher dispatcher;
    private final SnubaResponseParser parser;
    private final QueryCacheStore cacheStore;
    private final SnubaTelemetry telemetry;
    private final Duration cacheTtl;
    private final boolean useSnql;

    public SnubaQueryService(
            QueryParamsPreparer preparer,
            SnubaDispatcher dispatcher,
            SnubaResponseParser parser,
            QueryCacheStore cacheStore,
            SnubaTelemetry telemetry,
            Duration cacheTtl,
            boolean useSnql) {
        this.preparer = preparer;
        this.dispatcher = dispatcher;
        this.parser = parser;
        this.cacheStore = cacheStore;
        this.telemetry = telemetry;
        this.cacheTtl = cacheTtl;
        this.useSnql = useSnql;
    }

    public SnubaResult rawQuery(SnubaQueryParams params, boolean useCache) {
        return bulkRawQuery(List.of(params), params.getReferrer(), useCache).get(0);
    }

    /**
     * Runs several queries as one batch. Results are in the order of {@code queries}.
     *
     * @throws QueryWindowException when one of the queries has an empty time window
     * @throws SnubaException when the backend rejects one of the queries
     */
    public List<SnubaResult> bulkRawQuery(List<SnubaQueryParams> queries, String referrer, boolean useCache) {
        List<SnubaRequest> requests = new ArrayList<>(queries.size());
        List<SnubaTranslators> translators = new ArrayList<>(queries.size());
        List<String> keys = new ArrayList<>(queries.size());
        for (SnubaQueryParams params : queries) {
            PreparedQuery prepared = preparer.prepare(params);
            requests.add(SnubaRequest.legacy(prepared));
            translators.add(prepared.translators());
            keys.add(QueryCacheKeys.forLegacyBody(prepared.body()));
        }
        return run(requests, translators, keys, referrer, useCache);
    }

    public SnubaResult rawSnqlQuery(SnqlQuery query, String referrer, boolean useCache) {
        return bulkSnqlQuery(List.of(query), referrer, useCache).get(0);
    }

    /** Structured queries carry no id filters, so their rows are not translated beyond datetimes. */
    public List<SnubaResult> bulkSnqlQuery(List<SnqlQuery> queries, String referrer, boolean useCache) {
        List<SnubaRequest> requests = new ArrayList<>(queries.size());
        List<SnubaTranslators> translators = new ArrayList<>(queries.size());
        List<String> keys = new ArrayList<>(queries.size());
        for (SnqlQuery query : queries) {
            requests.add(SnubaRequest.snql(query));
            translators.add(SnubaTranslators.identity());
            keys.add(QueryCacheKeys.forSnql(query));
        }
        return run(requests, translators, keys, referrer, useCache);
    }

    private List<SnubaResult> run(
            List<SnubaRequest> requests,
            List<SnubaTranslators> translators,
            List<String> keys,
            String referrer,
            boolean useCache) {
        SnubaResult[] results = new SnubaResult[requests.size()];
        List<Integer> missing = new ArrayList<>();
        if (useCache) {
            Map<String, String> cached = cacheStore.getMany(new LinkedHashSet<>(keys));
            for (int i = 0; i < results.length; i++) {
                String hit = cached.get(keys.get(i));
                if (hit != null) {
                    results[i] = parser.fromCacheValue(hit);
                } else {
                    missing.add(i);
                }
            }
            telemetry.recordCacheLookup(results.length - missing.size(), missing.size());
            log.debug("Snuba cache lookup referrer={} hits={} misses={}",
                    referrer, results.length - missing.size(), missing.size());
        } else {
            for (int i = 0; i < results.length; i++) {
                missing.add(i);
            }
        }

        List<SnubaRequest> toSend = new ArrayList<>(missing.size());
        missing.forEach(index -> toSend.add(requests.get(index)));
        List<SnubaHttpResponse> responses = dispatcher.execute(toSend, referrer, useSnql);
        for (int j = 0; j < missing.size(); j++) {
            int index = missing.get(j);
            SnubaResult result = parser.parse(responses.get(j), translators.get(index));
            if (useCache) {
                String value = parser.toCacheValue(result);
                cacheStore.set(keys.get(index), value, cacheTtl);
                // hand out the cached form so hits and misses look the same
                result = parser.fromCacheValue(value);
            }
            results[index] = result;
        }
        return Arrays.asList(results);
    }

    /**
     * Aggregates {@code params} and nests the rows by its group-by columns. A query without
     * aggregations counts rows as {@value #DEFAULT_AGGREGATE}. An empty time window gives an empty
     * map.
     *
     * @throws IllegalStateException when the returned columns differ from the requested ones
     */
    public Object query(SnubaQueryParams params, boolean useCache) {
        return queryWithTotals(params, useCache).result();
    }

    public NestedResult queryWithTotals(SnubaQueryParams params, boolean useCache) {
        SnubaQueryParams effective = params.getAggregations().isEmpty()
                ? params.toBuilder().aggregations(List.of(Aggregation.count(DEFAULT_AGGREGATE))).build()
                : params;
        SnubaResult result;
        try {
            result = rawQuery(effective, useCache);
        } catch (QueryWindowException e) {
            log.debug("Empty query window referrer={}: {}", params.getReferrer(), e.getMessage());
            return new NestedResult(new LinkedHashMap<>(), effective.isTotals() ? new LinkedHashMap<>() : null);
        }

        Set<String> expected = effective.expectedResultColumns();
        Set<String> returned = new HashSet<>(result.columnNames());
        if (!expected.equals(returned)) {
            throw new IllegalStateException("Expected columns " + expected + " but the query returned " + returned);
        }
        List<String> aggregates = new ArrayList<>();
        effective.getAggregations().forEach(aggregation -> aggregates.add(aggregation.alias()));
        Object nested = ResultNesting.nestGroups(result.data(), effective.getGroupby(), aggregates);
        return new NestedResult(nested, result.totals());
    }

    /**
     * Runs {@code params} written in public field names: columns are resolved for the dataset,
     * result columns are renamed back and time series are zero-filled when a rollup is set.
     */
    public SnubaResult aliasedQuery(SnubaQueryParams params, boolean useCache) {
        ResolvedQuery resolved = AliasResolver.resolve(params, ColumnResolvers.forDataset(params.getDataset()));
        SnubaResult result = rawQuery(resolved.params(), useCache);

        List<Map<String, Object>> meta = new ArrayList<>(result.meta().size());
        for (Map<String, Object> column : result.meta()) {
            Map<String, Object> renamed = new LinkedHashMap<>(column);
            renamed.put("name", resolved.publicName(String.valueOf(column.get("name"))));
            meta.add(renamed);
        }
        List<Map<String, Object>> data = new ArrayList<>(result.data().size());
        for (Map<String, Object> row : result.data()) {
            Map<String, Object> renamed = new LinkedHashMap<>();
            row.forEach((column, value) -> renamed.put(resolved.publicName(column), value));
            data.add(renamed);
        }

        Integer rollup = params.getRollup();
        if (rollup != null && rollup > 0 && params.getStart() != null && params.getEnd() != null) {
            data = Zerofill.fill(data, params.getStart(), params.getEnd(), rollup, params.getOrderby());
        }
        return new SnubaResult(data, meta, result.totals());
    }

    /** Like {@link #rawQuery} but reports empty windows and backend failures as values. */
    public QueryOutcome<SnubaResult> tryRawQuery(SnubaQueryParams params, boolean useCache) {
        try {
            return QueryOutcome.success(rawQuery(params, useCache));
        } catch (QueryWindowException e) {
            return QueryOutcome.emptyWindow(e.getMessage());
        } catch (SnubaException e) {
            log.warn("Snuba query failed referrer={} retryable={}: {}", params.getReferrer(), e.retryable(), e.getMessage());
            return QueryOutcome.failure(e);
        }
    }

    /**
     * @param result nested aggregates, see {@link ResultNesting#nestGroups}
     * @param totals totals row, null unless totals were requested
     */
    public record NestedResult(Object result, Map<String, Object> totals) {}
}
