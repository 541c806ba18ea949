package com.lognog.query.ast;

import java.util.Objects;

/**
 * {@code field op value}, e.g. {@code severity<=warning} or {@code host=web*}.
 */
public final class ComparisonPredicate implements Predicate {

    private final FieldName field;
    private final ComparisonOperator operator;
    private final PredicateValue value;

    public ComparisonPredicate(FieldName field, ComparisonOperator operator, PredicateValue value) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");
    }

    public FieldName getField() {
        return field;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public PredicateValue getValue() {
        return value;
    }

    public ComparisonPredicate with(FieldName newField, PredicateValue newValue) {
        if (newField == field && newValue == value) {
            return this;
        }
        return new ComparisonPredicate(newField, operator, newValue);
    }

    @Override
    public int getPosition() {
        return field.getPosition();
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return field + operator.getSymbol() + value;
    }
}
