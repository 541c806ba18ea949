package com.lognog.query;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Non-fatal finding reported alongside a successful compilation,
 * e.g. a sort that a following aggregation discards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompileWarning {

    private final Integer position;
    private final String message;

    public CompileWarning(Integer position, String message) {
        this.position = position;
        this.message = message;
    }

    public Integer getPosition() {
        return position;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return position == null ? message : message + " (position " + position + ")";
    }
}
