package com.lognog.query.ast;

import java.util.Objects;

/**
 * {@code top} (most frequent values) or {@code rare} (least frequent values)
 * of one field. Produces the field and a {@code count} column.
 */
public final class TopStage extends AbstractStage {

    public static final int DEFAULT_LIMIT = 10;
    public static final String COUNT_FIELD = "count";

    private final boolean rare;
    private final long limit;
    private final FieldName field;

    public TopStage(boolean rare, long limit, FieldName field, int position) {
        super(position);
        this.rare = rare;
        this.limit = limit;
        this.field = Objects.requireNonNull(field, "field");
    }

    public boolean isRare() {
        return rare;
    }

    public long getLimit() {
        return limit;
    }

    public FieldName getField() {
        return field;
    }

    public TopStage withField(FieldName resolved) {
        return resolved == field ? this : new TopStage(rare, limit, resolved, getPosition());
    }

    @Override
    public String getCommand() {
        return rare ? "rare" : "top";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitTop(this);
    }
}
