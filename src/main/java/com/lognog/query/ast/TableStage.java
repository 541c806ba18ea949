package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Keeps only the listed fields, in the listed order.
 */
public final class TableStage extends AbstractStage {

    private final ImmutableList<FieldName> fields;

    public TableStage(List<FieldName> fields, int position) {
        super(position);
        this.fields = ImmutableList.copyOf(fields);
    }

    public List<FieldName> getFields() {
        return fields;
    }

    @Override
    public String getCommand() {
        return "table";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
