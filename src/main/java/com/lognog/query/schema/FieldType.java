package com.lognog.query.schema;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Value type of a schema field, a derived field or an output column.
 */
public enum FieldType {

    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    DATETIME("datetime"),
    BOOLEAN("boolean"),
    ARRAY("array"),

    /**
     * Type that cannot be determined statically, e.g. {@code null()}.
     * Compatible with every other type.
     */
    UNKNOWN("unknown");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    /**
     * Parse a string value to FieldType
     */
    public static FieldType fromValue(String value) {
        for (FieldType type : FieldType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown FieldType value: " + value);
    }
}
