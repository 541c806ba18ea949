package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Keeps the first row for each distinct combination of the listed fields.
 */
public final class DedupStage extends AbstractStage {

    private final ImmutableList<FieldName> fields;

    public DedupStage(List<FieldName> fields, int position) {
        super(position);
        this.fields = ImmutableList.copyOf(fields);
    }

    public List<FieldName> getFields() {
        return fields;
    }

    @Override
    public String getCommand() {
        return "dedup";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitDedup(this);
    }
}
