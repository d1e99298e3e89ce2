package org.silverscript.compiler.frontend.parser.ast;

/**
 * The binary operators, by precedence group.
 */
public enum BinaryOperator {
    OR("||"), AND("&&"),
    EQUAL("=="), NOT_EQUAL("!="),
    LESS("<"), LESS_EQUAL("<="), GREATER(">"), GREATER_EQUAL(">="),
    ADD("+"), SUBTRACT("-"),
    MULTIPLY("*"), DIVIDE("/"), MODULO("%");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return this == LESS || this == LESS_EQUAL || this == GREATER || this == GREATER_EQUAL;
    }

    public boolean isLogical() {
        return this == OR || this == AND;
    }

    public boolean isEquality() {
        return this == EQUAL || this == NOT_EQUAL;
    }
}
