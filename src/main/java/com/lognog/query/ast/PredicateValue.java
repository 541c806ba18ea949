package com.lognog.query.ast;

import com.lognog.query.expr.Expression;

import java.util.Objects;

/**
 * Right-hand side of a comparison.
 */
public final class PredicateValue {

    public enum Kind {
        STRING,
        NUMBER,
        WILDCARD,
        EXPRESSION
    }

    private final Kind kind;
    private final String text;
    private final WildcardPattern wildcard;
    private final Expression expression;
    private final int position;

    private PredicateValue(Kind kind, String text, WildcardPattern wildcard, Expression expression, int position) {
        this.kind = kind;
        this.text = text;
        this.wildcard = wildcard;
        this.expression = expression;
        this.position = position;
    }

    public static PredicateValue string(String text, int position) {
        return new PredicateValue(Kind.STRING, Objects.requireNonNull(text), null, null, position);
    }

    public static PredicateValue number(String text, int position) {
        return new PredicateValue(Kind.NUMBER, Objects.requireNonNull(text), null, null, position);
    }

    public static PredicateValue wildcard(WildcardPattern pattern, int position) {
        return new PredicateValue(Kind.WILDCARD, pattern.getPattern(), pattern, null, position);
    }

    public static PredicateValue expression(Expression expression, int position) {
        return new PredicateValue(Kind.EXPRESSION, null, null, Objects.requireNonNull(expression), position);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Literal text for string, number and wildcard values; null for expressions.
     */
    public String getText() {
        return text;
    }

    public WildcardPattern getWildcard() {
        return wildcard;
    }

    public Expression getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING:
                return "\"" + text + "\"";
            case EXPRESSION:
                return String.valueOf(expression);
            default:
                return text;
        }
    }
}
