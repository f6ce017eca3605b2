package com.snubalink.query.condition;

import java.util.Objects;

/** A value-producing node of a query: a column reference, a literal, or a function call. */
public sealed interface Expression permits Expression.Column, Expression.Literal, FunctionCall {

    static Column column(String name) {
        return new Column(name);
    }

    static Literal literal(Object value) {
        return new Literal(value);
    }

    record Column(String name) implements Expression {
        public Column {
            Objects.requireNonNull(name, "column name");
        }
    }

    /** Literal argument. Never resolved as a column; strings and instants are quoted on the wire. */
    record Literal(Object value) implements Expression {}
}
