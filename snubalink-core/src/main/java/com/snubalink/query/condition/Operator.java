package com.snubalink.query.condition;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Comparison operators of leaf conditions. Membership ({@code IN}) is modelled by {@link Membership}. */
public enum Operator {
    EQ("=", "equals"),
    NEQ("!=", "notEquals"),
    LT("<", "less"),
    GT(">", "greater"),
    LTE("<=", "lessOrEquals"),
    GTE(">=", "greaterOrEquals"),
    LIKE("LIKE", "like"),
    NOT_LIKE("NOT LIKE", "notLike"),
    IS_NULL("IS NULL", "isNull"),
    IS_NOT_NULL("IS NOT NULL", "isNotNull");

    /** Function names of the membership operators, which have no {@link Operator} constant. */
    public static final String IN_FUNCTION = "in";

    public static final String NOT_IN_FUNCTION = "notIn";

    private static final Map<String, String> FUNCTION_TO_OPERATOR = Map.ofEntries(
            Map.entry("equals", "="),
            Map.entry("notEquals", "!="),
            Map.entry("less", "<"),
            Map.entry("greater", ">"),
            Map.entry("lessOrEquals", "<="),
            Map.entry("greaterOrEquals", ">="),
            Map.entry("like", "LIKE"),
            Map.entry("notLike", "NOT LIKE"),
            Map.entry(IN_FUNCTION, "IN"),
            Map.entry(NOT_IN_FUNCTION, "NOT IN"),
            Map.entry("isNull", "IS NULL"),
            Map.entry("isNotNull", "IS NOT NULL"));

    private final String symbol;
    private final String function;

    Operator(String symbol, String function) {
        this.symbol = symbol;
        this.function = function;
    }

    public String symbol() {
        return symbol;
    }

    public String function() {
        return function;
    }

    public boolean isUnary() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        for (Operator op : values()) {
            if (op.symbol.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    public static boolean isMembershipSymbol(String symbol) {
        return "IN".equals(symbol) || "NOT IN".equals(symbol);
    }

    /** True for functions that are spelled-out comparisons, e.g. {@code equals} or {@code notIn}. */
    public static boolean isComparisonFunction(String function) {
        return FUNCTION_TO_OPERATOR.containsKey(function);
    }
}
