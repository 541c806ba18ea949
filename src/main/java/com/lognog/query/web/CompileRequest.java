package com.lognog.query.web;

import java.time.Instant;

/**
 * Request model for validating or compiling a query.
 * The time bounds are optional but must be given together.
 */
public class CompileRequest {
    private String query;
    private Instant earliest;
    private Instant latest;

    public CompileRequest() {
    }

    public CompileRequest(String query) {
        this.query = query;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Instant getEarliest() {
        return earliest;
    }

    public void setEarliest(Instant earliest) {
        this.earliest = earliest;
    }

    public Instant getLatest() {
        return latest;
    }

    public void setLatest(Instant latest) {
        this.latest = latest;
    }
}
