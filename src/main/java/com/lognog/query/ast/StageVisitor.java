package com.lognog.query.ast;

/**
 * Exhaustive handler over the stage variants.
 *
 * @param <R> result type
 */
public interface StageVisitor<R> {

    R visitSearch(SearchStage stage);

    R visitFilter(FilterStage stage);

    R visitStats(StatsStage stage);

    R visitEval(EvalStage stage);

    R visitTable(TableStage stage);

    R visitFields(FieldsStage stage);

    R visitRename(RenameStage stage);

    R visitDedup(DedupStage stage);

    R visitSort(SortStage stage);

    R visitLimit(LimitStage stage);

    R visitTop(TopStage stage);

    R visitBin(BinStage stage);

    R visitTimechart(TimechartStage stage);

    R visitRex(RexStage stage);
}
