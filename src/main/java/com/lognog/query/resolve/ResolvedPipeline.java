package com.lognog.query.resolve;

import com.google.common.collect.ImmutableList;
import com.lognog.query.CompileWarning;
import com.lognog.query.ast.Stage;
import com.lognog.query.schema.FieldSchema;

import java.util.List;

/**
 * A pipeline whose field references are canonical, whose severity names are
 * codes and whose expressions type-check, together with the field scope
 * after each stage.
 */
public final class ResolvedPipeline {

    private final ImmutableList<Stage> stages;
    private final ImmutableList<FieldScope> scopes;
    private final FieldSchema schema;
    private final ImmutableList<CompileWarning> warnings;

    public ResolvedPipeline(List<Stage> stages, List<FieldScope> scopes, FieldSchema schema,
                            List<CompileWarning> warnings) {
        if (stages.size() != scopes.size()) {
            throw new IllegalArgumentException("Expected one scope per stage");
        }
        this.stages = ImmutableList.copyOf(stages);
        this.scopes = ImmutableList.copyOf(scopes);
        this.schema = schema;
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public List<Stage> getStages() {
        return stages;
    }

    /**
     * Fields visible after stage {@code index} has run.
     */
    public FieldScope getScopeAfter(int index) {
        return scopes.get(index);
    }

    public FieldScope getInitialScope() {
        return FieldScope.of(schema);
    }

    /**
     * Fields the compiled query returns, in order.
     */
    public FieldScope getOutputScope() {
        return scopes.get(scopes.size() - 1);
    }

    public FieldSchema getSchema() {
        return schema;
    }

    public List<CompileWarning> getWarnings() {
        return warnings;
    }
}
