package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class StatsStage extends AbstractStage {

    private final ImmutableList<Aggregation> aggregations;
    private final ImmutableList<FieldName> groupBy;

    public StatsStage(List<Aggregation> aggregations, List<FieldName> groupBy, int position) {
        super(position);
        this.aggregations = ImmutableList.copyOf(aggregations);
        this.groupBy = ImmutableList.copyOf(groupBy);
    }

    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    public List<FieldName> getGroupBy() {
        return groupBy;
    }

    @Override
    public String getCommand() {
        return "stats";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitStats(this);
    }
}
