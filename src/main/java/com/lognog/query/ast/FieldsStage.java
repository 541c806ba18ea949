package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class FieldsStage extends AbstractStage {

    public enum Mode {
        INCLUDE,
        EXCLUDE
    }

    private final Mode mode;
    private final ImmutableList<FieldName> fields;

    public FieldsStage(Mode mode, List<FieldName> fields, int position) {
        super(position);
        this.mode = mode;
        this.fields = ImmutableList.copyOf(fields);
    }

    public Mode getMode() {
        return mode;
    }

    public List<FieldName> getFields() {
        return fields;
    }

    @Override
    public String getCommand() {
        return "fields";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitFields(this);
    }
}
