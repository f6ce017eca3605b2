package com.snubalink.query;

import com.snubalink.query.condition.Comparison;
import com.snubalink.query.condition.Condition;
import com.snubalink.query.condition.ConditionResolver;
import com.snubalink.query.condition.Expression;
import com.snubalink.query.condition.FunctionCall;
import com.snubalink.query.condition.Membership;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites a whole query from public names to backend columns.
 *
 * <p>Aliases the query itself derives (aggregations and aliased selected calls) are never
 * resolved. Conditions on such an alias can only be evaluated after aggregation, so they are moved
 * into {@code having}.
 */
public final class AliasResolver {

    /** Friendly array-join names and the nested columns they expand. */
    private static final Map<String, String> ARRAY_JOINS = Map.of(
            "error", "exception_stacks",
            "stack", "exception_frames");

    private AliasResolver() {}

    public static ResolvedQuery resolve(SnubaQueryParams params, ColumnResolver resolver) {
        Set<String> derived = params.derivedAliases();
        ColumnResolver aliasAware = name -> derived.contains(name) ? name : resolver.resolve(name);
        Map<String, String> translated = new HashMap<>();

        List<Expression> selected = new ArrayList<>();
        for (Expression column : params.getSelectedColumns()) {
            if (column instanceof FunctionCall call) {
                selected.add(ConditionResolver.resolveComplexColumn(call, resolver, derived));
                if (call.alias() != null) {
                    translated.put(call.alias(), call.alias());
                }
            } else if (column instanceof Expression.Column c) {
                String name = resolver.resolve(c.name());
                selected.add(Expression.column(name));
                translated.put(name, c.name());
            } else {
                selected.add(column);
            }
        }

        List<String> groupby = new ArrayList<>();
        for (String column : params.getGroupby()) {
            String name = aliasAware.resolve(column);
            groupby.add(name);
            translated.put(name, column);
        }

        List<Aggregation> aggregations = new ArrayList<>();
        for (Aggregation aggregation : params.getAggregations()) {
            List<String> columns = new ArrayList<>();
            aggregation.columns().forEach(column -> columns.add(aliasAware.resolve(column)));
            aggregations.add(aggregation.withColumns(columns));
        }

        Map<String, List<Object>> filterKeys = new LinkedHashMap<>();
        params.getFilterKeys().forEach((key, values) -> filterKeys.put(resolver.resolve(key), values));

        List<Condition> conditions = new ArrayList<>();
        List<Condition> having = new ArrayList<>(params.getHaving());
        for (Condition condition : params.getConditions()) {
            if (onDerivedAlias(condition, derived)) {
                having.add(condition);
            } else {
                conditions.add(ConditionResolver.resolve(condition, resolver));
            }
        }

        List<String> orderby = new ArrayList<>();
        for (String fieldWithOrder : params.getOrderby()) {
            boolean descending = fieldWithOrder.startsWith("-");
            String field = descending ? fieldWithOrder.substring(1) : fieldWithOrder;
            orderby.add((descending ? "-" : "") + aliasAware.resolve(field));
        }

        String arrayjoin = params.getArrayjoin();
        SnubaQueryParams resolved = params.toBuilder()
                .selectedColumns(selected)
                .groupby(groupby)
                .aggregations(aggregations)
                .filterKeys(filterKeys)
                .conditions(conditions)
                .having(having)
                .orderby(orderby)
                .arrayjoin(arrayjoin == null ? null : ARRAY_JOINS.getOrDefault(arrayjoin, arrayjoin))
                .build();
        return new ResolvedQuery(resolved, translated);
    }

    private static boolean onDerivedAlias(Condition condition, Set<String> derived) {
        Expression lhs = null;
        if (condition instanceof Comparison c) {
            lhs = c.lhs();
        } else if (condition instanceof Membership m) {
            lhs = m.lhs();
        }
        return lhs instanceof Expression.Column column && derived.contains(column.name());
    }
}
