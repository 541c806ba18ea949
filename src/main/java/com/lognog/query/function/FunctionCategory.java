package com.lognog.query.function;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FunctionCategory {

    MATH("math"),
    STRING("string"),
    CONDITIONAL("conditional"),
    TIME("time"),
    NETWORK("network");

    private final String value;

    FunctionCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
