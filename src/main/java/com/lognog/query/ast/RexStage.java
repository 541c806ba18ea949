package com.lognog.query.ast;

import java.util.Objects;

/**
 * Regex extraction of one new field per named capture group.
 */
public final class RexStage extends AbstractStage {

    private final FieldName field;
    private final RexPattern pattern;

    /**
     * @param field source field; {@code _raw} when the query names none
     */
    public RexStage(FieldName field, RexPattern pattern, int position) {
        super(position);
        this.field = Objects.requireNonNull(field, "field");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public FieldName getField() {
        return field;
    }

    public RexPattern getPattern() {
        return pattern;
    }

    public RexStage withField(FieldName resolved) {
        return resolved == field ? this : new RexStage(resolved, pattern, getPosition());
    }

    @Override
    public String getCommand() {
        return "rex";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitRex(this);
    }
}
