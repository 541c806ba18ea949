package com.lognog.query.ast;

import com.lognog.query.expr.Expression;
import com.lognog.query.function.AggregationFunction;

import java.util.Objects;

/**
 * One aggregation of a stats or timechart stage, e.g. {@code avg(bytes) as mean_bytes}.
 */
public final class Aggregation {

    private final String name;
    private final AggregationFunction function;
    private final Integer percentile;
    private final Expression argument;
    private final String alias;
    private final int position;

    /**
     * @param name       function name as written, lowercased ({@code mean}, {@code p95})
     * @param percentile N of {@code pN}/{@code percN}, otherwise null
     * @param argument   null only for a bare {@code count}
     */
    public Aggregation(String name, AggregationFunction function, Integer percentile,
                       Expression argument, String alias, int position) {
        this.name = Objects.requireNonNull(name, "name");
        this.function = Objects.requireNonNull(function, "function");
        this.percentile = percentile;
        this.argument = argument;
        this.alias = Objects.requireNonNull(alias, "alias");
        this.position = position;
    }

    public String getName() {
        return name;
    }

    public AggregationFunction getFunction() {
        return function;
    }

    public Integer getPercentile() {
        return percentile;
    }

    public Expression getArgument() {
        return argument;
    }

    public String getAlias() {
        return alias;
    }

    public int getPosition() {
        return position;
    }

    public Aggregation withArgument(Expression resolved) {
        return resolved == argument ? this : new Aggregation(name, function, percentile, resolved, alias, position);
    }

    @Override
    public String toString() {
        return name + "(" + (argument == null ? "" : argument) + ") as " + alias;
    }
}
