package com.lognog.query.ast;

import java.util.Objects;

/**
 * Case-insensitive substring match. Written {@code field~value}, or produced
 * for a bare search term against the raw message.
 */
public final class ContainsPredicate implements Predicate {

    public static final String RAW_FIELD = "_raw";

    private final FieldName field;
    private final String value;

    public ContainsPredicate(FieldName field, String value) {
        this.field = Objects.requireNonNull(field, "field");
        this.value = Objects.requireNonNull(value, "value");
    }

    public FieldName getField() {
        return field;
    }

    public String getValue() {
        return value;
    }

    public ContainsPredicate withField(FieldName newField) {
        return newField == field ? this : new ContainsPredicate(newField, value);
    }

    @Override
    public int getPosition() {
        return field.getPosition();
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitContains(this);
    }

    @Override
    public String toString() {
        return field + "~\"" + value + "\"";
    }
}
