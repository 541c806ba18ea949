package com.lognog.query.ast;

import com.lognog.query.lexer.TokenType;

public enum ComparisonOperator {

    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    /**
     * Map a comparison token to its operator.
     */
    public static ComparisonOperator fromToken(TokenType type) {
        switch (type) {
            case EQUALS:
                return EQ;
            case NOT_EQUALS:
                return NE;
            case LESS_THAN:
                return LT;
            case LESS_THAN_EQ:
                return LE;
            case GREATER_THAN:
                return GT;
            case GREATER_THAN_EQ:
                return GE;
            default:
                throw new IllegalArgumentException("Not a comparison token: " + type);
        }
    }
}
