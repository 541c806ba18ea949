package com.lognog.query.ast;

import java.util.Objects;

/**
 * A field as written in the query, with the offset of its token so that
 * resolve errors can point at it.
 */
public final class FieldName {

    private final String name;
    private final int position;

    public FieldName(String name, int position) {
        this.name = Objects.requireNonNull(name, "name");
        this.position = position;
    }

    public String getName() {
        return name;
    }

    public int getPosition() {
        return position;
    }

    public FieldName withName(String canonical) {
        return canonical.equals(name) ? this : new FieldName(canonical, position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldName)) return false;
        FieldName that = (FieldName) o;
        return position == that.position && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, position);
    }

    @Override
    public String toString() {
        return name;
    }
}
