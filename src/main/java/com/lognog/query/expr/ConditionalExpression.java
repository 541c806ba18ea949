package com.lognog.query.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Multi-way branch built from {@code if(c, a, b)} or
 * {@code case(c1, v1, c2, v2, ..., [default])}.
 */
public final class ConditionalExpression implements Expression {

    public static final class Branch {
        private final Expression condition;
        private final Expression value;

        public Branch(Expression condition, Expression value) {
            this.condition = Objects.requireNonNull(condition, "condition");
            this.value = Objects.requireNonNull(value, "value");
        }

        public Expression getCondition() {
            return condition;
        }

        public Expression getValue() {
            return value;
        }
    }

    private final String function;
    private final ImmutableList<Branch> branches;
    private final Expression otherwise;
    private final int position;

    /**
     * @param function  {@code if} or {@code case}, kept for error messages
     * @param otherwise value when no condition holds; null means SQL NULL
     */
    public ConditionalExpression(String function, List<Branch> branches, Expression otherwise, int position) {
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("A conditional needs at least one branch");
        }
        this.function = Objects.requireNonNull(function, "function");
        this.branches = ImmutableList.copyOf(branches);
        this.otherwise = otherwise;
        this.position = position;
    }

    public String getFunction() {
        return function;
    }

    public List<Branch> getBranches() {
        return branches;
    }

    public Expression getOtherwise() {
        return otherwise;
    }

    public boolean hasOtherwise() {
        return otherwise != null;
    }

    public ConditionalExpression with(List<Branch> newBranches, Expression newOtherwise) {
        if (newBranches.equals(branches) && newOtherwise == otherwise) {
            return this;
        }
        return new ConditionalExpression(function, newBranches, newOtherwise, position);
    }

    @Override
    public int getPosition() {
        return position;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(function).append('(');
        for (int i = 0; i < branches.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(branches.get(i).getCondition()).append(", ").append(branches.get(i).getValue());
        }
        if (otherwise != null) {
            sb.append(", ").append(otherwise);
        }
        return sb.append(')').toString();
    }
}
