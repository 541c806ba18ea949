package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class RenameStage extends AbstractStage {

    private final ImmutableList<RenamePair> pairs;

    public RenameStage(List<RenamePair> pairs, int position) {
        super(position);
        this.pairs = ImmutableList.copyOf(pairs);
    }

    public List<RenamePair> getPairs() {
        return pairs;
    }

    @Override
    public String getCommand() {
        return "rename";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitRename(this);
    }
}
