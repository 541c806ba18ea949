package com.lognog.query;

import com.lognog.query.schema.FieldType;

import java.util.Objects;

/**
 * One column of a compiled query's result, in result order.
 */
public class OutputColumn {

    private final String name;
    private final FieldType type;

    public OutputColumn(String name, FieldType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutputColumn)) return false;
        OutputColumn that = (OutputColumn) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type.getValue();
    }
}
