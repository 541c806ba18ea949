package com.lognog.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Compiler phase that produced an error. The UI uses it to decide whether the
 * problem is a typo in the query text or a field the schema does not know.
 */
public enum CompilePhase {

    LEX("lex"),
    PARSE("parse"),
    RESOLVE("resolve"),
    EXPR("expr"),
    CODEGEN("codegen");

    private final String value;

    CompilePhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
