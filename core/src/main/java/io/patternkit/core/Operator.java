// file: src/main/java/io/patternkit/core/Operator.java
package io.patternkit.core;

import java.util.Locale;
import java.util.Objects;

/**
 * The four arithmetic operators a {@link ReversibleCommand} can record.
 * <p>
 * Every operator has an algebraic inverse:
 *  - PLUS     <-> MINUS
 *  - ASTERISK <-> SLASH
 * <p>
 * {@link #inverse()} is total and its own inverse, so
 * {@code op.inverse().inverse() == op} for every constant.
 */
public enum Operator {
    PLUS("+"), MINUS("-"), ASTERISK("*"), SLASH("/");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /** Display symbol, e.g. "+" for PLUS. */
    public String symbol() {
        return symbol;
    }

    /** Operator that undoes the numeric effect of this one. */
    public Operator inverse() {
        return switch (this) {
            case PLUS -> MINUS;
            case MINUS -> PLUS;
            case ASTERISK -> SLASH;
            case SLASH -> ASTERISK;
        };
    }

    /**
     * Parse an operator from its symbol ("+", "-", "*", "/") or its
     * case-insensitive name ("plus", "MINUS", ...).
     *
     * @throws IllegalArgumentException if the text names no operator
     */
    public static Operator fromSymbol(String text) {
        Objects.requireNonNull(text, "text");
        String t = text.trim();
        for (Operator op : values()) {
            if (op.symbol.equals(t) || op.name().equals(t.toUpperCase(Locale.ROOT))) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + text);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
