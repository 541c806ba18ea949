package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Root of the syntax tree: the ordered stages of one query.
 * The first stage is always a {@link SearchStage}.
 */
public final class Pipeline {

    private final ImmutableList<Stage> stages;

    public Pipeline(List<? extends Stage> stages) {
        if (stages.isEmpty() || !(stages.get(0) instanceof SearchStage)) {
            throw new IllegalArgumentException("A pipeline must start with a search stage");
        }
        for (int i = 1; i < stages.size(); i++) {
            if (stages.get(i) instanceof SearchStage) {
                throw new IllegalArgumentException("Only the first stage may be a search stage");
            }
        }
        this.stages = ImmutableList.copyOf(stages);
    }

    public List<Stage> getStages() {
        return stages;
    }

    public SearchStage getSearch() {
        return (SearchStage) stages.get(0);
    }

    public int size() {
        return stages.size();
    }

    @Override
    public String toString() {
        return "Pipeline" + stages;
    }
}
