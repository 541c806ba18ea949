package com.lognog.query.expr;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class FunctionCallExpression implements Expression {

    private final String name;
    private final ImmutableList<Expression> arguments;
    private final int position;

    /**
     * @param name function name; stored lowercased since lookups ignore case
     */
    public FunctionCallExpression(String name, List<Expression> arguments, int position) {
        this.name = Objects.requireNonNull(name, "name").toLowerCase(Locale.ROOT);
        this.arguments = ImmutableList.copyOf(arguments);
        this.position = position;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public FunctionCallExpression withArguments(List<Expression> newArguments) {
        return newArguments.equals(arguments) ? this : new FunctionCallExpression(name, newArguments, position);
    }

    @Override
    public int getPosition() {
        return position;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return name + "(" + Joiner.on(", ").join(arguments) + ")";
    }
}
