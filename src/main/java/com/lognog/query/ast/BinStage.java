package com.lognog.query.ast;

import java.util.Objects;

/**
 * Buckets a time or numeric field. Without an alias the field is replaced
 * in place by its bucket.
 */
public final class BinStage extends AbstractStage {

    private final Span span;
    private final FieldName field;
    private final FieldName alias;

    public BinStage(Span span, FieldName field, FieldName alias, int position) {
        super(position);
        this.span = Objects.requireNonNull(span, "span");
        this.field = Objects.requireNonNull(field, "field");
        this.alias = alias;
    }

    public Span getSpan() {
        return span;
    }

    public FieldName getField() {
        return field;
    }

    public FieldName getAlias() {
        return alias;
    }

    /**
     * Name of the field the bucket is exposed as.
     */
    public String getOutputName() {
        return alias != null ? alias.getName() : field.getName();
    }

    public BinStage withField(FieldName resolved) {
        return resolved == field ? this : new BinStage(span, resolved, alias, getPosition());
    }

    @Override
    public String getCommand() {
        return "bin";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitBin(this);
    }
}
