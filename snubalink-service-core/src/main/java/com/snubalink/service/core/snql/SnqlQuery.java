package com.snubalink.service.core.snql;

import com.snubalink.query.IsoTimes;
import com.snubalink.query.condition.AnyOf;
import com.snubalink.query.condition.Comparison;
import com.snubalink.query.condition.Condition;
import com.snubalink.query.condition.Expression;
import com.snubalink.query.condition.FunctionCall;
import com.snubalink.query.condition.FunctionCondition;
import com.snubalink.query.condition.Membership;
import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Object form of a structured query. Immutable; {@link #toSnql()} renders the textual query
 * posted to {@code /{dataset}/snql}.
 */
public final class SnqlQuery {

    public enum Direction {
        ASC,
        DESC
    }

    public record OrderBy(Expression expression, Direction direction) {
        public OrderBy {
            Objects.requireNonNull(expression, "expression");
            direction = direction == null ? Direction.ASC : direction;
        }

        /** {@code -column} sorts descending, anything else ascending. */
        public static OrderBy parse(String field) {
            return field.startsWith("-")
                    ? new OrderBy(Expression.column(field.substring(1)), Direction.DESC)
                    : new OrderBy(Expression.column(field), Direction.ASC);
        }
    }

    private final String dataset;
    private final String entity;
    private final Number sample;
    private final List<Expression> select;
    private final List<Expression> groupby;
    private final String arrayJoin;
    private final List<Condition> where;
    private final List<Condition> having;
    private final List<OrderBy> orderby;
    private final Integer limit;
    private final Integer offset;
    private final Integer granularity;
    private final boolean totals;
    private final Boolean turbo;
    private final Boolean consistent;
    private final Boolean debug;

    private SnqlQuery(Builder b) {
        this.dataset = Objects.requireNonNull(b.dataset, "dataset");
        this.entity = b.entity == null ? b.dataset : b.entity;
        this.sample = b.sample;
        this.select = List.copyOf(b.select);
        this.groupby = List.copyOf(b.groupby);
        this.arrayJoin = b.arrayJoin;
        this.where = List.copyOf(b.where);
        this.having = List.copyOf(b.having);
        this.orderby = List.copyOf(b.orderby);
        this.limit = b.limit;
        this.offset = b.offset;
        this.granularity = b.granularity;
        this.totals = b.totals;
        this.turbo = b.turbo;
        this.consistent = b.consistent;
        this.debug = b.debug;
    }

    public static Builder builder(String dataset) {
        return new Builder().dataset(dataset);
    }

    public String toSnql() {
        StringBuilder out = new StringBuilder("MATCH (").append(entity);
        if (sample != null) {
            out.append(" SAMPLE ").append(sample);
        }
        out.append(')');
        if (!select.isEmpty()) {
            out.append(" SELECT ").append(joinExpressions(select));
        }
        if (!groupby.isEmpty()) {
            out.append(" BY ").append(joinExpressions(groupby));
        }
        if (arrayJoin != null) {
            out.append(" ARRAY JOIN ").append(arrayJoin);
        }
        if (!where.isEmpty()) {
            out.append(" WHERE ").append(joinConditions(where));
        }
        if (!having.isEmpty()) {
            out.append(" HAVING ").append(joinConditions(having));
        }
        if (!orderby.isEmpty()) {
            StringJoiner order = new StringJoiner(", ");
            orderby.forEach(o -> order.add(renderExpression(o.expression()) + " " + o.direction()));
            out.append(" ORDER BY ").append(order);
        }
        if (limit != null) {
            out.append(" LIMIT ").append(limit);
        }
        if (offset != null) {
            out.append(" OFFSET ").append(offset);
        }
        if (granularity != null) {
            out.append(" GRANULARITY ").append(granularity);
        }
        if (totals) {
            out.append(" TOTALS True");
        }
        return out.toString();
    }

    static String renderCondition(Condition condition) {
        if (condition instanceof Comparison c) {
            String lhs = renderExpression(c.lhs());
            if (c.operator().isUnary()) {
                return lhs + " " + c.operator().symbol();
            }
            return lhs + " " + c.operator().symbol() + " " + renderLiteral(c.value());
        }
        if (condition instanceof Membership m) {
            return renderExpression(m.lhs()) + " " + m.symbol() + " " + renderLiteral(m.values());
        }
        if (condition instanceof FunctionCondition f) {
            return renderExpression(f.call()) + " = 1";
        }
        AnyOf any = (AnyOf) condition;
        StringJoiner or = new StringJoiner(" OR ", "(", ")");
        any.alternatives().forEach(alternative -> or.add(renderCondition(alternative)));
        return or.toString();
    }

    static String renderExpression(Expression expression) {
        if (expression instanceof Expression.Column column) {
            return column.name();
        }
        if (expression instanceof Expression.Literal literal) {
            return renderLiteral(literal.value());
        }
        FunctionCall call = (FunctionCall) expression;
        StringBuilder out = new StringBuilder(call.function());
        // parametric aggregates such as quantiles(0.5)(duration) and bare count()
        if (!call.function().endsWith(")") || !call.args().isEmpty()) {
            StringJoiner args = new StringJoiner(", ", "(", ")");
            call.args().forEach(arg -> args.add(renderExpression(arg)));
            out.append(args);
        }
        if (call.alias() != null && !call.alias().isEmpty()) {
            out.append(" AS `").append(call.alias()).append('`');
        }
        return out.toString();
    }

    static String renderLiteral(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String s) {
            return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        if (value instanceof TemporalAccessor temporal) {
            Instant instant = IsoTimes.toUtcInstant(temporal);
            return "toDateTime('" + IsoTimes.formatNaive(instant) + "')";
        }
        if (value instanceof Collection<?> values) {
            StringJoiner tuple = new StringJoiner(", ", "tuple(", ")");
            values.forEach(item -> tuple.add(renderLiteral(item)));
            return tuple.toString();
        }
        return String.valueOf(value);
    }

    private static String joinExpressions(List<Expression> expressions) {
        StringJoiner joiner = new StringJoiner(", ");
        expressions.forEach(expression -> joiner.add(renderExpression(expression)));
        return joiner.toString();
    }

    private static String joinConditions(List<Condition> conditions) {
        StringJoiner joiner = new StringJoiner(" AND ");
        conditions.forEach(condition -> joiner.add(renderCondition(condition)));
        return joiner.toString();
    }

    public String getDataset() {
        return dataset;
    }

    public String getEntity() {
        return entity;
    }

    public List<Expression> getSelect() {
        return select;
    }

    public List<Expression> getGroupby() {
        return groupby;
    }

    public List<Condition> getWhere() {
        return where;
    }

    public List<Condition> getHaving() {
        return having;
    }

    public List<OrderBy> getOrderby() {
        return orderby;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public Integer getGranularity() {
        return granularity;
    }

    public boolean isTotals() {
        return totals;
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

    @Override
    public boolean equals(Object o) {
        return o instanceof SnqlQuery other && dataset.equals(other.dataset) && toSnql().equals(other.toSnql());
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataset, toSnql());
    }

    @Override
    public String toString() {
        return toSnql();
    }

    // ---------- Builder

    public static final class Builder {
        private String dataset;
        private String entity;
        private Number sample;
        private final List<Expression> select = new ArrayList<>();
        private final List<Expression> groupby = new ArrayList<>();
        private String arrayJoin;
        private final List<Condition> where = new ArrayList<>();
        private final List<Condition> having = new ArrayList<>();
        private final List<OrderBy> orderby = new ArrayList<>();
        private Integer limit;
        private Integer offset;
        private Integer granularity;
        private boolean totals;
        private Boolean turbo;
        private Boolean consistent;
        private Boolean debug;

        public Builder dataset(String v) {
            this.dataset = v;
            return this;
        }

        public Builder entity(String v) {
            this.entity = v;
            return this;
        }

        public Builder sample(Number v) {
            this.sample = v;
            return this;
        }

        public Builder select(Collection<? extends Expression> v) {
            this.select.addAll(v);
            return this;
        }

        public Builder select(Expression... v) {
            return select(List.of(v));
        }

        public Builder groupby(Collection<? extends Expression> v) {
            this.groupby.addAll(v);
            return this;
        }

        public Builder groupby(Expression... v) {
            return groupby(List.of(v));
        }

        public Builder arrayJoin(String v) {
            this.arrayJoin = v;
            return this;
        }

        public Builder where(Collection<? extends Condition> v) {
            this.where.addAll(v);
            return this;
        }

        public Builder where(Condition... v) {
            return where(List.of(v));
        }

        public Builder having(Collection<? extends Condition> v) {
            this.having.addAll(v);
            return this;
        }

        public Builder orderby(Collection<OrderBy> v) {
            this.orderby.addAll(v);
            return this;
        }

        public Builder orderby(OrderBy... v) {
            return orderby(List.of(v));
        }

        public Builder limit(Integer v) {
            this.limit = v;
            return this;
        }

        public Builder offset(Integer v) {
            this.offset = v;
            return this;
        }

        public Builder granularity(Integer v) {
            this.granularity = v;
            return this;
        }

        public Builder totals(boolean v) {
            this.totals = v;
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

        public SnqlQuery build() {
            return new SnqlQuery(this);
        }
    }
}
