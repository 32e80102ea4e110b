package org.helmsman.runtime.model;

/**
 * Comparison operators available to conditions.
 */
public enum Operator {
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    EQ("=="),
    NE("!="),
    IN("in");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return true for the four ordering operators, which need numbers on both sides.
     */
    public boolean isNumeric() {
        return this == LT || this == GT || this == LE || this == GE;
    }

    /**
     * Looks up an operator by its symbol ({@code "<="}) or by its constant name ({@code "LE"}).
     *
     * @param text The symbol or name.
     * @return The operator.
     * @throws IllegalArgumentException if nothing matches.
     */
    public static Operator fromSymbol(String text) {
        for (Operator op : values()) {
            if (op.symbol.equals(text) || op.name().equalsIgnoreCase(text)) {
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
