package com.lognog.query.expr;

import java.util.Objects;

public final class LiteralExpression implements Expression {

    public enum Kind {
        NUMBER,
        STRING,
        BOOLEAN,
        NULL
    }

    private final Kind kind;
    private final String text;
    private final int position;

    private LiteralExpression(Kind kind, String text, int position) {
        this.kind = kind;
        this.text = text;
        this.position = position;
    }

    public static LiteralExpression number(String text, int position) {
        return new LiteralExpression(Kind.NUMBER, Objects.requireNonNull(text), position);
    }

    public static LiteralExpression string(String text, int position) {
        return new LiteralExpression(Kind.STRING, Objects.requireNonNull(text), position);
    }

    public static LiteralExpression bool(boolean value, int position) {
        return new LiteralExpression(Kind.BOOLEAN, Boolean.toString(value), position);
    }

    public static LiteralExpression nullValue(int position) {
        return new LiteralExpression(Kind.NULL, null, position);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Number text, unquoted string, {@code true}/{@code false}, or null for NULL.
     */
    public String getText() {
        return text;
    }

    public boolean isIntegral() {
        return kind == Kind.NUMBER && text.indexOf('.') < 0;
    }

    @Override
    public int getPosition() {
        return position;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        if (kind == Kind.STRING) {
            return "\"" + text + "\"";
        }
        return kind == Kind.NULL ? "null" : text;
    }
}
