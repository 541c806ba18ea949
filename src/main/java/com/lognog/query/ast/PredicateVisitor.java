package com.lognog.query.ast;

public interface PredicateVisitor<R> {

    R visitAnd(AndPredicate predicate);

    R visitOr(OrPredicate predicate);

    R visitNot(NotPredicate predicate);

    R visitComparison(ComparisonPredicate predicate);

    R visitContains(ContainsPredicate predicate);
}
