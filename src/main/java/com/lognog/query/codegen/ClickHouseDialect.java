package com.lognog.query.codegen;

import com.lognog.query.ast.Span;
import com.lognog.query.ast.SpanUnit;
import com.lognog.query.ast.WildcardPattern;
import com.lognog.query.function.AggregationFunction;

import java.math.BigDecimal;
import java.util.List;

/**
 * ClickHouse, the primary log store.
 */
public class ClickHouseDialect extends AbstractSqlDialect {

    public static final String NAME = "clickhouse";
    public static final String DEFAULT_TABLE = "lognog.logs";

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
        return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
    }

    @Override
    public String aggregate(AggregationFunction function, Integer percentile, String argument, String timestamp,
                            int position) {
        switch (function) {
            case COUNT:
                return argument == null ? "count()" : "count(" + argument + ")";
            case DISTINCT_COUNT:
                return "uniq(" + argument + ")";
            case SUM:
                return "sum(" + argument + ")";
            case AVG:
                return "avg(" + argument + ")";
            case MIN:
                return "min(" + argument + ")";
            case MAX:
                return "max(" + argument + ")";
            case MEDIAN:
                return "median(" + argument + ")";
            case MODE:
                return "topK(1)(" + argument + ")[1]";
            case STDDEV:
                return "stddevPop(" + argument + ")";
            case VARIANCE:
                return "varPop(" + argument + ")";
            case RANGE:
                return "(max(" + argument + ") - min(" + argument + "))";
            case VALUES:
                return "groupUniqArray(" + argument + ")";
            case LIST:
                return "groupArray(" + argument + ")";
            case FIRST:
                return "any(" + argument + ")";
            case LAST:
                return "anyLast(" + argument + ")";
            case EARLIEST:
            case LATEST:
                if (timestamp == null) {
                    throw new CodegenException(function.getValue()
                        + " needs the timestamp field, which is not available here", position);
                }
                return (function == AggregationFunction.EARLIEST ? "argMin(" : "argMax(")
                    + argument + ", " + timestamp + ")";
            case PERCENTILE:
                return "quantile(" + quantile(percentile) + ")(" + argument + ")";
            default:
                throw new CodegenException("Unsupported aggregation " + function.getValue(), position);
        }
    }

    static String quantile(int percentile) {
        return BigDecimal.valueOf(percentile).movePointLeft(2).stripTrailingZeros().toPlainString();
    }

    @Override
    public String wildcardMatch(String column, WildcardPattern pattern) {
        switch (pattern.getShape()) {
            case MATCH_ALL:
                return column + " IS NOT NULL";
            case PREFIX:
                return "startsWith(" + column + ", " + quoteString(pattern.getPrefix()) + ")";
            case SUFFIX:
                return "endsWith(" + column + ", " + quoteString(pattern.getSuffix()) + ")";
            default:
                return column + " LIKE " + quoteString(likePattern(pattern));
        }
    }

    @Override
    public String contains(String column, String value) {
        return "positionCaseInsensitive(" + column + ", " + quoteString(value) + ") > 0";
    }

    @Override
    public String containsPattern(String column, WildcardPattern pattern) {
        return column + " ILIKE " + quoteString(likePattern(pattern));
    }

    @Override
    public String timeBucket(String column, Span span) {
        long amount = span.getWholeAmount();
        SpanUnit unit = span.getUnit();
        if (unit == SpanUnit.MINUTE) {
            if (amount == 1) {
                return "toStartOfMinute(" + column + ")";
            } else if (amount == 5) {
                return "toStartOfFiveMinutes(" + column + ")";
            } else if (amount == 10) {
                return "toStartOfTenMinutes(" + column + ")";
            } else if (amount == 15) {
                return "toStartOfFifteenMinutes(" + column + ")";
            }
        } else if (unit == SpanUnit.HOUR && amount == 1) {
            return "toStartOfHour(" + column + ")";
        } else if (unit == SpanUnit.DAY && amount == 1) {
            return "toStartOfDay(" + column + ")";
        }
        return "toStartOfInterval(" + column + ", INTERVAL " + amount + " " + unit.getSqlName() + ")";
    }

    @Override
    public String numericBucket(String column, String width) {
        return "(floor(" + column + " / " + width + ") * " + width + ")";
    }

    @Override
    public String extractGroup(String column, String pattern, int index, int position) {
        return "extractGroups(" + column + ", " + quoteString(pattern) + ")[" + index + "]";
    }

    @Override
    public String conditional(List<String> conditions, List<String> values, String otherwise) {
        if (conditions.size() == 1 && otherwise != null) {
            return "if(" + conditions.get(0) + ", " + values.get(0) + ", " + otherwise + ")";
        }
        return super.conditional(conditions, values, otherwise);
    }

    @Override
    public boolean supportsLimitBy() {
        return true;
    }
}
