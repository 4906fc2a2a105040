package io.flowtemplate.core.ast;

/** Infix operators, grouped by the kind of operands they work on. */
public enum BinaryOperator {
    // arithmetic
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    // comparison
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    LESS_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_EQUAL(">="),
    // logical
    AND("&&"),
    OR("||"),
    // string
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /** The operator as written in a template. */
    public String symbol() {
        return symbol;
    }
}
