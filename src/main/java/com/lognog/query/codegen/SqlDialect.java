package com.lognog.query.codegen;

import com.lognog.query.ast.Span;
import com.lognog.query.ast.WildcardPattern;
import com.lognog.query.function.AggregationFunction;
import com.lognog.query.function.CodegenStrategy;
import com.lognog.query.function.FunctionSpec;

import java.time.Instant;
import java.util.List;

/**
 * The SQL differences between the supported stores. The generator decides
 * the query shape; a dialect spells out the individual constructs.
 *
 * Methods that build a construct the store cannot express throw
 * {@link CodegenException}.
 */
public interface SqlDialect {

    /**
     * Name used in configuration, e.g. {@code clickhouse}.
     */
    String getName();

    String getDefaultTable();

    String quoteIdentifier(String name);

    String quoteString(String value);

    String datetimeLiteral(Instant instant);

    String booleanLiteral(boolean value);

    /**
     * @param argument      argument SQL, null for a bare {@code count}
     * @param timestamp     SQL of the timestamp, null when it is not available
     * @param percentile    N of {@code pN}, otherwise null
     */
    String aggregate(AggregationFunction function, Integer percentile, String argument, String timestamp,
                     int position);

    /**
     * Positive match of {@code column} against a prefix, suffix or general pattern.
     */
    String wildcardMatch(String column, WildcardPattern pattern);

    /**
     * Case-insensitive substring test.
     */
    String contains(String column, String value);

    /**
     * Case-insensitive match of a pattern written with {@code *}.
     */
    String containsPattern(String column, WildcardPattern pattern);

    /**
     * Start of the {@code span} bucket holding {@code column}.
     */
    String timeBucket(String column, Span span);

    /**
     * Lower bound of the {@code width}-wide bucket holding {@code column}.
     */
    String numericBucket(String column, String width);

    /**
     * Group {@code index} (1-based) of a positional regular expression.
     */
    String extractGroup(String column, String pattern, int index, int position);

    /**
     * Strategy for an eval function in this dialect.
     */
    CodegenStrategy strategyFor(FunctionSpec function);

    String conditional(List<String> conditions, List<String> values, String otherwise);

    String divide(String left, String right);

    /**
     * True when dedup is written as {@code LIMIT 1 BY}, false when it is a
     * plain {@code GROUP BY}.
     */
    boolean supportsLimitBy();
}
