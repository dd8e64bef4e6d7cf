package com.spreadsheet.fgraph.formula;

import java.util.HashMap;
import java.util.Map;

/**
 * Binary operators with their binding strength. Higher binds tighter; all are
 * left-associative.
 */
public enum Operator {
    EQ("=", 1),
    NE("<>", 1),
    LT("<", 1),
    GT(">", 1),
    LE("<=", 1),
    GE(">=", 1),
    CONCAT("&", 2),
    ADD("+", 3),
    SUB("-", 3),
    MUL("*", 4),
    DIV("/", 4),
    POW("^", 5);

    private static final Map<String, Operator> BY_SYMBOL = new HashMap<>();

    static {
        for (Operator op : values())
            BY_SYMBOL.put(op.symbol, op);
    }

    private final String symbol;
    private final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    /** @return the binary operator for the symbol, or null. */
    public static Operator fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 1;
    }
}
