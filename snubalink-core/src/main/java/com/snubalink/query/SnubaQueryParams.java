package com.snubalink.query;

import com.snubalink.query.condition.Condition;
import com.snubalink.query.condition.Expression;
import com.snubalink.query.condition.FunctionCall;
import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A logical query against one dataset, expressed in public column names. Immutable; derive a
 * modified copy with {@link #toBuilder()}.
 *
 * <p>{@code start} is inclusive and {@code end} exclusive. Both are UTC instants: the builder
 * accepts zoned, offset and naive date-times, naive ones being read as UTC.
 */
public final class SnubaQueryParams {

    // -------- Target
    private final Dataset dataset;
    private final Instant start;
    private final Instant end;

    // -------- Shape
    private final List<String> groupby;
    private final List<Condition> conditions;
    private final List<Expression> selectedColumns;
    private final List<Aggregation> aggregations;
    private final Map<String, List<Object>> filterKeys;
    private final Integer rollup;
    private final List<String> orderby;
    private final List<Condition> having;
    private final Integer limit;
    private final Integer offset;
    private final boolean totals;

    // -------- Routing / backend flags
    private final String referrer;
    private final boolean groupRelease;
    private final Boolean turbo;
    private final Boolean consistent;
    private final Boolean debug;
    private final Number sample;
    private final String arrayjoin;

    private SnubaQueryParams(Builder b) {
        this.dataset = Objects.requireNonNull(b.dataset, "dataset");
        this.start = b.start;
        this.end = b.end;
        this.groupby = List.copyOf(b.groupby);
        this.conditions = List.copyOf(b.conditions);
        this.selectedColumns = List.copyOf(b.selectedColumns);
        this.aggregations = List.copyOf(b.aggregations);
        Map<String, List<Object>> filters = new LinkedHashMap<>();
        b.filterKeys.forEach((key, values) -> filters.put(key, Collections.unmodifiableList(new ArrayList<Object>(values))));
        this.filterKeys = Collections.unmodifiableMap(filters);
        this.rollup = b.rollup;
        this.orderby = List.copyOf(b.orderby);
        this.having = List.copyOf(b.having);
        this.limit = b.limit;
        this.offset = b.offset;
        this.totals = b.totals;
        this.referrer = b.referrer;
        this.groupRelease = b.groupRelease;
        this.turbo = b.turbo;
        this.consistent = b.consistent;
        this.debug = b.debug;
        this.sample = b.sample;
        this.arrayjoin = b.arrayjoin;
        derivedAliases();
    }

    public static Builder builder(Dataset dataset) {
        return new Builder().dataset(dataset);
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .dataset(dataset)
                .start(start)
                .end(end)
                .groupby(groupby)
                .conditions(conditions)
                .selectedColumns(selectedColumns)
                .aggregations(aggregations)
                .rollup(rollup)
                .orderby(orderby)
                .having(having)
                .limit(limit)
                .offset(offset)
                .totals(totals)
                .referrer(referrer)
                .groupRelease(groupRelease)
                .turbo(turbo)
                .consistent(consistent)
                .debug(debug)
                .sample(sample)
                .arrayjoin(arrayjoin);
        filterKeys.forEach(b::filter);
        return b;
    }

    /**
     * Aliases introduced by aggregations and aliased selected calls, in declaration order.
     *
     * @throws IllegalArgumentException when an alias is declared twice
     */
    public Set<String> derivedAliases() {
        Set<String> aliases = new LinkedHashSet<>();
        for (Aggregation aggregation : aggregations) {
            addAlias(aliases, aggregation.alias());
        }
        for (Expression column : selectedColumns) {
            if (column instanceof FunctionCall call) {
                addAlias(aliases, call.alias());
            }
        }
        return aliases;
    }

    private static void addAlias(Set<String> aliases, String alias) {
        if (alias != null && !alias.isEmpty() && !aliases.add(alias)) {
            throw new IllegalArgumentException("Duplicate alias in query: " + alias);
        }
    }

    /** Names the result rows are expected to carry: group-by columns, aggregate aliases and selected columns. */
    public Set<String> expectedResultColumns() {
        Set<String> names = new HashSet<>(groupby);
        aggregations.forEach(a -> names.add(a.alias()));
        for (Expression column : selectedColumns) {
            if (column instanceof FunctionCall call) {
                names.add(call.alias());
            } else if (column instanceof Expression.Column c) {
                names.add(c.name());
            }
        }
        return names;
    }

    public Dataset getDataset() {
        return dataset;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public List<String> getGroupby() {
        return groupby;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public List<Expression> getSelectedColumns() {
        return selectedColumns;
    }

    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    public Map<String, List<Object>> getFilterKeys() {
        return filterKeys;
    }

    public Integer getRollup() {
        return rollup;
    }

    public List<String> getOrderby() {
        return orderby;
    }

    public List<Condition> getHaving() {
        return having;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public boolean isTotals() {
        return totals;
    }

    public String getReferrer() {
        return referrer;
    }

    public boolean isGroupRelease() {
        return groupRelease;
    }

    public Boolean getTurbo() {
        return turbo;
    }

    public Boolean getConsistent() {
        return consistent;
    }

    public Boolean getDebug() {
        return debug;
    }

    public Number getSample() {
        return sample;
    }

    public String getArrayjoin() {
        return arrayjoin;
    }

    @Override
    public String toString() {
        return "SnubaQueryParams{dataset=" + dataset + ", start=" + start + ", end=" + end + ", groupby=" + groupby
                + ", conditions=" + conditions + ", aggregations=" + aggregations + ", filterKeys=" + filterKeys
                + ", referrer=" + referrer + '}';
    }

    // ---------- Builder

    public static final class Builder {
        private Dataset dataset;
        private Instant start;
        private Instant end;
        private final List<String> groupby = new ArrayList<>();
        private final List<Condition> conditions = new ArrayList<>();
        private final List<Expression> selectedColumns = new ArrayList<>();
        private final List<Aggregation> aggregations = new ArrayList<>();
        private final Map<String, Collection<?>> filterKeys = new LinkedHashMap<>();
        private Integer rollup;
        private final List<String> orderby = new ArrayList<>();
        private final List<Condition> having = new ArrayList<>();
        private Integer limit;
        private Integer offset;
        private boolean totals;
        private String referrer;
        private boolean groupRelease;
        private Boolean turbo;
        private Boolean consistent;
        private Boolean debug;
        private Number sample;
        private String arrayjoin;

        public Builder dataset(Dataset v) {
            this.dataset = v;
            return this;
        }

        public Builder start(TemporalAccessor v) {
            this.start = IsoTimes.toUtcInstant(v);
            return this;
        }

        public Builder end(TemporalAccessor v) {
            this.end = IsoTimes.toUtcInstant(v);
            return this;
        }

        public Builder groupby(Collection<String> v) {
            this.groupby.clear();
            this.groupby.addAll(v);
            return this;
        }

        public Builder groupby(String... v) {
            return groupby(List.of(v));
        }

        public Builder conditions(Collection<? extends Condition> v) {
            this.conditions.clear();
            this.conditions.addAll(v);
            return this;
        }

        public Builder condition(Condition v) {
            this.conditions.add(v);
            return this;
        }

        public Builder selectedColumns(Collection<? extends Expression> v) {
            this.selectedColumns.clear();
            this.selectedColumns.addAll(v);
            return this;
        }

        public Builder selectColumn(String name) {
            this.selectedColumns.add(Expression.column(name));
            return this;
        }

        public Builder aggregations(Collection<Aggregation> v) {
            this.aggregations.clear();
            this.aggregations.addAll(v);
            return this;
        }

        public Builder aggregation(String function, String column, String alias) {
            this.aggregations.add(Aggregation.of(function, column, alias));
            return this;
        }

        /** Adds or replaces one filter key. A {@code null} element stands for "column is null". */
        public Builder filter(String key, Collection<?> values) {
            this.filterKeys.put(key, values == null ? List.of() : values);
            return this;
        }

        public Builder filterKeys(Map<String, ? extends Collection<?>> v) {
            this.filterKeys.clear();
            v.forEach(this::filter);
            return this;
        }

        public Builder rollup(Integer v) {
            this.rollup = v;
            return this;
        }

        public Builder orderby(Collection<String> v) {
            this.orderby.clear();
            this.orderby.addAll(v);
            return this;
        }

        public Builder orderby(String... v) {
            return orderby(List.of(v));
        }

        public Builder having(Collection<? extends Condition> v) {
            this.having.clear();
            this.having.addAll(v);
            return this;
        }

        public Builder limit(Integer v) {
            this.limit = v;
            return this;
        }

        public Builder offset(Integer v) {
            this.offset = v;
            return this;
        }

        public Builder totals(boolean v) {
            this.totals = v;
            return this;
        }

        public Builder referrer(String v) {
            this.referrer = v;
            return this;
        }

        public Builder groupRelease(boolean v) {
            this.groupRelease = v;
            return this;
        }

        public Builder turbo(Boolean v) {
            this.turbo = v;
            return this;
        }

        public Builder consistent(Boolean v) {
            this.consistent = v;
            return this;
        }

        public Builder debug(Boolean v) {
            this.debug = v;
            return this;
        }

        public Builder sample(Number v) {
            this.sample = v;
            return this;
        }

        public Builder arrayjoin(String v) {
            this.arrayjoin = v;
            return this;
        }

        public SnubaQueryParams build() {
            return new SnubaQueryParams(this);
        }
    }
}
