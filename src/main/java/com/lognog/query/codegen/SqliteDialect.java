package com.lognog.query.codegen;

import com.google.common.collect.ImmutableMap;
import com.lognog.query.ast.Span;
import com.lognog.query.ast.WildcardPattern;
import com.lognog.query.function.AggregationFunction;
import com.lognog.query.function.CodegenStrategy;
import com.lognog.query.function.FunctionCategory;
import com.lognog.query.function.FunctionSpec;

import static com.lognog.query.function.CodegenStrategy.direct;
import static com.lognog.query.function.CodegenStrategy.infix;
import static com.lognog.query.function.CodegenStrategy.template;
import static com.lognog.query.function.CodegenStrategy.unsupported;

/**
 * SQLite, used by the single-node "lite" deployment.
 *
 * SQLite has no percentile, regular expression or IP functions; queries that
 * need them are rejected rather than approximated.
 */
public class SqliteDialect extends AbstractSqlDialect {

    public static final String NAME = "sqlite";
    public static final String DEFAULT_TABLE = "logs";

    private static final String LIKE_ESCAPE = " ESCAPE '\\'";

    private static final ImmutableMap<String, CodegenStrategy> OVERRIDES = ImmutableMap.<String, CodegenStrategy>builder()
        .put("len", direct("length"))
        .put("length", direct("length"))
        .put("trim", direct("trim"))
        .put("ltrim", direct("ltrim"))
        .put("rtrim", direct("rtrim"))
        .put("substr", direct("substr"))
        .put("substring", direct("substr"))
        .put("replace", direct("replace"))
        .put("split", unsupported("split is not available in SQLite"))
        .put("concat", infix("||"))
        .put("tostring", template("CAST({0} AS TEXT)"))
        .put("tonumber", template("CAST({0} AS REAL)"))
        .put("match", unsupported("regular expressions are not available in SQLite"))
        .put("nullif", direct("nullif"))
        .put("true", template("1"))
        .put("false", template("0"))
        .put("min", direct("min"))
        .put("max", direct("max"))
        .put("now", template("datetime('now')"))
        .put("strftime", template("strftime({1}, {0})"))
        .build();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDefaultTable() {
        return DEFAULT_TABLE;
    }

    @Override
    public String quoteString(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String booleanLiteral(boolean value) {
        return value ? "1" : "0";
    }

    @Override
    public String aggregate(AggregationFunction function, Integer percentile, String argument, String timestamp,
                            int position) {
        switch (function) {
            case COUNT:
                return argument == null ? "count(*)" : "count(" + argument + ")";
            case DISTINCT_COUNT:
                return "count(DISTINCT " + argument + ")";
            case SUM:
                return "sum(" + argument + ")";
            case AVG:
                return "avg(" + argument + ")";
            case MIN:
                return "min(" + argument + ")";
            case MAX:
                return "max(" + argument + ")";
            case RANGE:
                return "(max(" + argument + ") - min(" + argument + "))";
            case VALUES:
                return "group_concat(DISTINCT " + argument + ")";
            case LIST:
                return "group_concat(" + argument + ")";
            default:
                String name = function == AggregationFunction.PERCENTILE ? "p" + percentile : function.getValue();
                throw new CodegenException("Aggregation '" + name + "' is not supported by SQLite", position);
        }
    }

    @Override
    public String wildcardMatch(String column, WildcardPattern pattern) {
        if (pattern.getShape() == WildcardPattern.Shape.MATCH_ALL) {
            return column + " IS NOT NULL";
        }
        return column + " LIKE " + quoteString(likePattern(pattern)) + LIKE_ESCAPE;
    }

    @Override
    public String contains(String column, String value) {
        return "instr(lower(" + column + "), lower(" + quoteString(value) + ")) > 0";
    }

    @Override
    public String containsPattern(String column, WildcardPattern pattern) {
        return column + " LIKE " + quoteString(likePattern(pattern)) + LIKE_ESCAPE;
    }

    @Override
    public String timeBucket(String column, Span span) {
        long seconds = span.toSeconds();
        return "datetime((CAST(strftime('%s', " + column + ") AS INTEGER) / " + seconds + ") * " + seconds
            + ", 'unixepoch')";
    }

    /**
     * SQLite has floor() only when built with its math functions. CAST
     * truncates toward zero, so negative fractions are moved down by one.
     */
    @Override
    public String numericBucket(String column, String width) {
        String quotient = "(CAST(" + column + " AS REAL) / " + width + ")";
        String truncated = "CAST(" + quotient + " AS INTEGER)";
        return "((" + truncated + " - (" + quotient + " < " + truncated + ")) * " + width + ")";
    }

    @Override
    public String extractGroup(String column, String pattern, int index, int position) {
        throw new CodegenException("rex is not supported by SQLite, which has no regular expressions", position);
    }

    @Override
    public CodegenStrategy strategyFor(FunctionSpec function) {
        if (function.getCategory() == FunctionCategory.NETWORK) {
            return unsupported("IP functions are not available in SQLite");
        }
        CodegenStrategy override = OVERRIDES.get(function.getName());
        return override != null ? override : function.getStrategy();
    }

    @Override
    public String divide(String left, String right) {
        return "(CAST(" + left + " AS REAL) / " + right + ")";
    }

    @Override
    public boolean supportsLimitBy() {
        return false;
    }
}
