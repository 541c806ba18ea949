package com.lognog.query.expr;

/**
 * Infix operators of the expression language, grouped by kind.
 */
public enum BinaryOperator {

    ADD("+", Kind.ARITHMETIC),
    SUBTRACT("-", Kind.ARITHMETIC),
    MULTIPLY("*", Kind.ARITHMETIC),
    DIVIDE("/", Kind.ARITHMETIC),
    MODULO("%", Kind.ARITHMETIC),
    EQ("=", Kind.COMPARISON),
    NE("!=", Kind.COMPARISON),
    LT("<", Kind.COMPARISON),
    LE("<=", Kind.COMPARISON),
    GT(">", Kind.COMPARISON),
    GE(">=", Kind.COMPARISON),
    AND("AND", Kind.LOGICAL),
    OR("OR", Kind.LOGICAL);

    public enum Kind {
        ARITHMETIC,
        COMPARISON,
        LOGICAL
    }

    private final String symbol;
    private final Kind kind;

    BinaryOperator(String symbol, Kind kind) {
        this.symbol = symbol;
        this.kind = kind;
    }

    /**
     * SQL spelling of the operator; identical in every supported dialect.
     */
    public String getSymbol() {
        return symbol;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }
}
