package com.lognog.query.expr;

/**
 * Node of an eval, where or aggregation-argument expression.
 */
public interface Expression {

    /**
     * Offset of the node's first token in the query text.
     */
    int getPosition();

    <R> R accept(ExpressionVisitor<R> visitor);
}
