package com.lognog.query.ast;

/**
 * One pipe-separated segment of a pipeline.
 *
 * The set of stages is closed: every consumer handles each variant through
 * {@link StageVisitor}, so adding a stage means adding a visitor method.
 */
public interface Stage {

    /**
     * Offset of the stage's command keyword in the query text.
     */
    int getPosition();

    /**
     * Keyword that introduced the stage, lowercased.
     */
    String getCommand();

    <R> R accept(StageVisitor<R> visitor);
}
