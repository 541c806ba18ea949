package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class SortStage extends AbstractStage {

    private final ImmutableList<SortField> keys;

    public SortStage(List<SortField> keys, int position) {
        super(position);
        this.keys = ImmutableList.copyOf(keys);
    }

    public List<SortField> getKeys() {
        return keys;
    }

    @Override
    public String getCommand() {
        return "sort";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitSort(this);
    }
}
