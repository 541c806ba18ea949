package com.lognog.query.ast;

/**
 * Boolean filter tree used by search, filter and where stages.
 */
public interface Predicate {

    int getPosition();

    <R> R accept(PredicateVisitor<R> visitor);
}
