package com.lognog.query.expr;

import java.util.Objects;

public final class FieldRefExpression implements Expression {

    private final String name;
    private final int position;

    public FieldRefExpression(String name, int position) {
        this.name = Objects.requireNonNull(name, "name");
        this.position = position;
    }

    public String getName() {
        return name;
    }

    public FieldRefExpression withName(String canonical) {
        return canonical.equals(name) ? this : new FieldRefExpression(canonical, position);
    }

    @Override
    public int getPosition() {
        return position;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFieldRef(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
