package com.lognog.query;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Structured compile error handed to callers so the query editor can
 * underline the offending token.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompileError {

    private final CompilePhase stage;
    private final Integer position;
    private final String message;

    public CompileError(CompilePhase stage, Integer position, String message) {
        this.stage = stage;
        this.position = position;
        this.message = message;
    }

    public CompilePhase getStage() {
        return stage;
    }

    public Integer getPosition() {
        return position;
    }

    public String getMessage() {
        return message;
    }
}
