package com.lognog.query.web;

import com.lognog.query.CompileWarning;

import java.util.List;

/**
 * Result of a dry-run validation. Invalid queries are answered with a
 * {@link com.lognog.query.CompileError} instead.
 */
public class ValidationResponse {
    private final boolean valid;
    private final List<CompileWarning> warnings;

    public ValidationResponse(boolean valid, List<CompileWarning> warnings) {
        this.valid = valid;
        this.warnings = warnings;
    }

    public boolean isValid() {
        return valid;
    }

    public List<CompileWarning> getWarnings() {
        return warnings;
    }
}
