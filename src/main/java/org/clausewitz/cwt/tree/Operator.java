package org.clausewitz.cwt.tree;

import java.util.Optional;

/**
 * Assignment and comparison operators between a key and its value.
 */
public enum Operator {
    EQUALS("="),
    DOUBLE_EQUALS("=="),
    NOT_EQUALS("!="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    SAFE_EQUALS("?=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return this != EQUALS && this != SAFE_EQUALS;
    }

    public static Optional<Operator> fromSymbol(String text) {
        for (var op : values()) {
            if (op.symbol.equals(text)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
