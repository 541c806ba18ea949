package com.lognog.query.ast;

import java.util.Objects;

/**
 * Represents a sort key with its direction
 */
public final class SortField {

    private final FieldName field;
    private final boolean descending;

    public SortField(FieldName field, boolean descending) {
        this.field = Objects.requireNonNull(field, "field");
        this.descending = descending;
    }

    public FieldName getField() {
        return field;
    }

    public boolean isDescending() {
        return descending;
    }

    public boolean isAscending() {
        return !descending;
    }

    public SortField withField(FieldName resolved) {
        return resolved == field ? this : new SortField(resolved, descending);
    }

    @Override
    public String toString() {
        return field + (descending ? " desc" : " asc");
    }
}
