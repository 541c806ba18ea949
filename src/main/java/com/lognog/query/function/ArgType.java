package com.lognog.query.function;

import com.lognog.query.schema.FieldType;

/**
 * Constraint on one function argument. {@link FieldType#UNKNOWN} satisfies
 * every constraint.
 */
public enum ArgType {

    NUMERIC("number"),
    STRING("string"),
    BOOLEAN("boolean"),
    TIME("datetime"),
    ANY("any");

    private final String description;

    ArgType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean accepts(FieldType type) {
        if (type == FieldType.UNKNOWN || this == ANY) {
            return true;
        }
        switch (this) {
            case NUMERIC:
                return type.isNumeric();
            case STRING:
                return type == FieldType.STRING;
            case BOOLEAN:
                return type == FieldType.BOOLEAN;
            case TIME:
                return type == FieldType.DATETIME;
            default:
                return false;
        }
    }
}
