package com.lognog.query.ast;

import java.util.Objects;

public final class AndPredicate implements Predicate {

    private final Predicate left;
    private final Predicate right;

    public AndPredicate(Predicate left, Predicate right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Predicate getLeft() {
        return left;
    }

    public Predicate getRight() {
        return right;
    }

    @Override
    public int getPosition() {
        return left.getPosition();
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
        return "(" + left + " AND " + right + ")";
    }
}
