package com.lognog.query.ast;

import java.util.Objects;

public final class NotPredicate implements Predicate {

    private final Predicate operand;
    private final int position;

    public NotPredicate(Predicate operand, int position) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.position = position;
    }

    public Predicate getOperand() {
        return operand;
    }

    @Override
    public int getPosition() {
        return position;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public String toString() {
        return "NOT " + operand;
    }
}
