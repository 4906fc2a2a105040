package io.flowtemplate.core.ast;

/** Prefix operators. */
public enum UnaryOperator {
    /** Logical negation of truthiness: {@code !value}. */
    NOT("!"),
    /** Numeric negation: {@code -value}. */
    MINUS("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
