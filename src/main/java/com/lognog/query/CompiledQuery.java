package com.lognog.query;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Result of a successful compilation: SQL text for the log store, the shape of
 * its result and any warnings found on the way.
 */
public class CompiledQuery {

    private final String sql;
    private final ImmutableList<OutputColumn> outputColumns;
    private final ImmutableList<CompileWarning> warnings;

    public CompiledQuery(String sql, List<OutputColumn> outputColumns, List<CompileWarning> warnings) {
        this.sql = sql;
        this.outputColumns = ImmutableList.copyOf(outputColumns);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public String getSql() {
        return sql;
    }

    public List<OutputColumn> getOutputColumns() {
        return outputColumns;
    }

    public List<CompileWarning> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "CompiledQuery{sql='" + sql + "', outputColumns=" + outputColumns + "}";
    }
}
