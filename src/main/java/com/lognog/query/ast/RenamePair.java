package com.lognog.query.ast;

import java.util.Objects;

public final class RenamePair {

    private final FieldName from;
    private final FieldName to;

    public RenamePair(FieldName from, FieldName to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public FieldName getFrom() {
        return from;
    }

    public FieldName getTo() {
        return to;
    }

    @Override
    public String toString() {
        return from + " as " + to;
    }
}
