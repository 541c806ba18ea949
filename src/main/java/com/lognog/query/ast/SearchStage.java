package com.lognog.query.ast;

/**
 * The leading stage of every pipeline. A null predicate matches every row
 * ({@code search *} or an empty query).
 */
public final class SearchStage extends AbstractStage {

    private final Predicate predicate;

    public SearchStage(Predicate predicate, int position) {
        super(position);
        this.predicate = predicate;
    }

    public Predicate getPredicate() {
        return predicate;
    }

    public boolean matchesAll() {
        return predicate == null;
    }

    @Override
    public String getCommand() {
        return "search";
    }

    @Override
    public <R> R accept(StageVisitor<R> visitor) {
        return visitor.visitSearch(this);
    }
}
