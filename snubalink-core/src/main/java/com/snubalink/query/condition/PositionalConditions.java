package com.snubalink.query.condition;

import com.snubalink.query.ColumnResolvers;
import com.snubalink.query.IsoTimes;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts between the typed condition tree and the positional list form used by the legacy JSON
 * protocol: {@code [column, op, value]}, {@code [function, [args], alias]} and nested OR lists.
 */
public final class PositionalConditions {

    private PositionalConditions() {}

    public static Condition parse(Object raw) {
        List<?> list = asList(raw);
        if (list == null || list.isEmpty()) {
            throw unexpected(raw);
        }
        Integer index = functionIndex(list);
        if (index != null) {
            String name = (String) list.get(index);
            if (index == 1 && list.size() == 3 && Operator.isMembershipSymbol(name)) {
                return new Membership(
                        parseExpression(list.get(0)), "NOT IN".equals(name), new ArrayList<>(asList(list.get(2))));
            }
            if (index == 1 && list.size() == 3 && Operator.fromSymbol(name).isPresent()) {
                return leaf(list, raw);
            }
            if (index == 0 && list.size() <= 3) {
                return new FunctionCondition(parseCall(list, raw));
            }
            throw unexpected(raw);
        }
        Object first = list.get(0);
        if (first instanceof String && list.size() == 3) {
            return leaf(list, raw);
        }
        List<?> firstList = asList(first);
        if (firstList != null) {
            if (functionIndex(firstList) != null && list.size() == 3 && list.get(1) instanceof String) {
                return leaf(list, raw);
            }
            List<Condition> alternatives = new ArrayList<>();
            for (Object item : list) {
                alternatives.add(parse(item));
            }
            return new AnyOf(alternatives);
        }
        throw unexpected(raw);
    }

    /**
     * Parses a column expression: bare strings are column names, quoted strings and numbers are
     * literals, lists shaped like {@code [function, [args], alias]} are calls.
     */
    public static Expression parseExpression(Object raw) {
        if (raw instanceof String s) {
            if (ColumnResolvers.isQuotedLiteral(s)) {
                return Expression.literal(s.substring(1, s.length() - 1));
            }
            return Expression.column(s);
        }
        List<?> list = asList(raw);
        if (list != null) {
            Integer index = functionIndex(list);
            if (index != null && index == 0) {
                return parseCall(list, raw);
            }
        }
        return Expression.literal(raw);
    }

    public static Object render(Condition condition) {
        if (condition instanceof Comparison c) {
            return Arrays.asList(render(c.lhs()), c.operator().symbol(), renderValue(c.value()));
        }
        if (condition instanceof Membership m) {
            return Arrays.asList(render(m.lhs()), m.symbol(), renderValue(m.values()));
        }
        if (condition instanceof FunctionCondition f) {
            return render(f.call());
        }
        if (condition instanceof AnyOf any) {
            List<Object> out = new ArrayList<>();
            any.alternatives().forEach(alternative -> out.add(render(alternative)));
            return out;
        }
        throw new IllegalArgumentException("Unsupported condition " + condition);
    }

    public static List<Object> renderAll(List<Condition> conditions) {
        List<Object> out = new ArrayList<>();
        conditions.forEach(condition -> out.add(render(condition)));
        return out;
    }

    public static Object render(Expression expression) {
        if (expression instanceof Expression.Column column) {
            return column.name();
        }
        if (expression instanceof Expression.Literal literal) {
            return quote(literal.value());
        }
        FunctionCall call = (FunctionCall) expression;
        List<Object> args = new ArrayList<>();
        call.args().forEach(arg -> args.add(render(arg)));
        return call.alias() == null
                ? Arrays.asList(call.function(), args)
                : Arrays.asList(call.function(), args, call.alias());
    }

    /** Literal function argument: strings and date-times are single-quoted, the rest passes through. */
    static Object quote(Object value) {
        if (value instanceof String s) {
            return "'" + s + "'";
        }
        if (value instanceof TemporalAccessor temporal) {
            return "'" + IsoTimes.formatNaive(IsoTimes.toUtcInstant(temporal)) + "'";
        }
        return value;
    }

    /** Right-hand values go out as JSON: date-times of any kind become naive UTC strings. */
    private static Object renderValue(Object value) {
        if (value instanceof TemporalAccessor temporal) {
            return IsoTimes.formatNaive(IsoTimes.toUtcInstant(temporal));
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(item -> out.add(renderValue(item)));
            return out;
        }
        return value;
    }

    private static Comparison leaf(List<?> list, Object raw) {
        if (!(list.get(1) instanceof String symbol)) {
            throw unexpected(raw);
        }
        Operator op = Operator.fromSymbol(symbol).orElseThrow(() -> unexpected(raw));
        return new Comparison(parseExpression(list.get(0)), op, list.get(2));
    }

    private static FunctionCall parseCall(List<?> list, Object raw) {
        String name = (String) list.get(0);
        List<Expression> args = new ArrayList<>();
        for (Object arg : asList(list.get(1))) {
            args.add(parseExpression(arg));
        }
        Object alias = list.size() > 2 ? list.get(2) : null;
        if (alias != null && !(alias instanceof String)) {
            throw unexpected(raw);
        }
        return new FunctionCall(name, args, (String) alias);
    }

    /** Position of a string immediately followed by a list, which marks a function name. */
    static Integer functionIndex(List<?> list) {
        for (int i = 0; i < list.size() - 1; i++) {
            if (list.get(i) instanceof String && asList(list.get(i + 1)) != null) {
                return i;
            }
        }
        return null;
    }

    private static List<?> asList(Object raw) {
        if (raw instanceof List<?> list) {
            return list;
        }
        if (raw instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }

    private static IllegalArgumentException unexpected(Object raw) {
        return new IllegalArgumentException("Unexpected condition format " + raw);
    }
}
