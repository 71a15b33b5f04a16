package com.sattline.lint.loader.ast;

import java.util.Locale;

public enum BinaryOperator {
    OR("OR"),
    AND("AND"),
    EQUAL("=="),
    NOT_EQUAL("<>"),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("MOD");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static BinaryOperator fromSymbol(String text) {
        String normalized = text.toUpperCase(Locale.ROOT);
        for (BinaryOperator operator : values()) {
            if (operator.symbol.equals(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + text);
    }
}
