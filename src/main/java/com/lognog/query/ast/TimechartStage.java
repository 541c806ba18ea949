package com.lognog.query.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Stats over time buckets of the timestamp field. The bucket column,
 * {@code time_bucket}, is always the first group key.
 */
public final class TimechartStage extends AbstractStage {

    public static final String BUCKET_FIELD = "time_bucket";

    private final Span span;
    private final ImmutableList<Aggregation> aggregations;
    private final ImmutableList<FieldName> groupBy;

    /**
     * @param span null when the query gives none; the configured default applies
     */
    public TimechartStage(Span span, List<Aggregation> aggregations, List<FieldName> groupBy, int position) {
        super(position);
        this.span = span;
        this.aggregations = ImmutableList.copyOf(aggregations);
        this.groupBy = ImmutableList.copyOf(groupBy);
    }

    public Span getSpan() {
        return span;
    }

    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    public List<FieldName> getGroupBy() {
        return groupBy;
    }

    @Override
    public String getCommand() {
        return "timechart";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitTimechart(this);
    }
}
