package com.lognog.query.ast;

import java.util.Objects;

/**
 * Post-filter written {@code filter}, {@code where}, or a non-leading {@code search}.
 */
public final class FilterStage extends AbstractStage {

    private final String keyword;
    private final Predicate predicate;

    public FilterStage(String keyword, Predicate predicate, int position) {
        super(position);
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    public Predicate getPredicate() {
        return predicate;
    }

    @Override
    public String getCommand() {
        return keyword;
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitFilter(this);
    }
}
