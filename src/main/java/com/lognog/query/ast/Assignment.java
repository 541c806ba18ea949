package com.lognog.query.ast;

import com.lognog.query.expr.Expression;

import java.util.Objects;

/**
 * {@code target = expression} inside an eval stage.
 */
public final class Assignment {

    private final FieldName target;
    private final Expression expression;

    public Assignment(FieldName target, Expression expression) {
        this.target = Objects.requireNonNull(target, "target");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public FieldName getTarget() {
        return target;
    }

    public Expression getExpression() {
        return expression;
    }

    public Assignment withExpression(Expression resolved) {
        return resolved == expression ? this : new Assignment(target, resolved);
    }

    @Override
    public String toString() {
        return target + "=" + expression;
    }
}
