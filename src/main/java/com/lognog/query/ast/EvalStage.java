package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Computed fields. Assignments run in order, so a later one may read an
 * earlier one.
 */
public final class EvalStage extends AbstractStage {

    private final ImmutableList<Assignment> assignments;

    public EvalStage(List<Assignment> assignments, int position) {
        super(position);
        this.assignments = ImmutableList.copyOf(assignments);
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    @Override
    public String getCommand() {
        return "eval";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitEval(this);
    }
}
