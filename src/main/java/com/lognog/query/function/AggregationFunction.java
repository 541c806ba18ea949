package com.lognog.query.function;

import com.fasterxml.jackson.annotation.JsonValue;
import com.lognog.query.schema.FieldType;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Aggregations available to stats and timechart.
 */
public enum AggregationFunction {

    COUNT("count", FieldType.INTEGER, false, false),
    DISTINCT_COUNT("dc", FieldType.INTEGER, true, false),
    SUM("sum", FieldType.FLOAT, true, true),
    AVG("avg", FieldType.FLOAT, true, true),
    MIN("min", null, true, false),
    MAX("max", null, true, false),
    MEDIAN("median", FieldType.FLOAT, true, true),
    MODE("mode", null, true, false),
    STDDEV("stddev", FieldType.FLOAT, true, true),
    VARIANCE("variance", FieldType.FLOAT, true, true),
    RANGE("range", FieldType.FLOAT, true, true),
    VALUES("values", FieldType.ARRAY, true, false),
    LIST("list", FieldType.ARRAY, true, false),
    FIRST("first", null, true, false),
    LAST("last", null, true, false),
    EARLIEST("earliest", null, true, false),
    LATEST("latest", null, true, false),

    /**
     * {@code pN} or {@code percN}, N in 1..99.
     */
    PERCENTILE("percentile", FieldType.FLOAT, true, true);

    private static final Pattern PERCENTILE_NAME = Pattern.compile("(?:p|perc)(\\d{1,2})");

    private final String value;
    private final FieldType resultType;
    private final boolean argumentRequired;
    private final boolean numericArgument;

    AggregationFunction(String value, FieldType resultType, boolean argumentRequired, boolean numericArgument) {
        this.value = value;
        this.resultType = resultType;
        this.argumentRequired = argumentRequired;
        this.numericArgument = numericArgument;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Fixed result type, or null when the result has the argument's type.
     */
    public FieldType getResultType() {
        return resultType;
    }

    public FieldType resultType(FieldType argumentType) {
        if (resultType != null) {
            return resultType;
        }
        return argumentType == null ? FieldType.UNKNOWN : argumentType;
    }

    public boolean isArgumentRequired() {
        return argumentRequired;
    }

    public boolean requiresNumericArgument() {
        return numericArgument;
    }

    /**
     * Look up an aggregation by the name used in a query. {@code mean} is
     * {@link #AVG}; {@code p95} and {@code perc95} are {@link #PERCENTILE}.
     *
     * @return the function, or null when the name is not an aggregation
     */
    public static AggregationFunction lookup(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if ("mean".equals(lower)) {
            return AVG;
        }
        if (percentileOf(lower) != null) {
            return PERCENTILE;
        }
        for (AggregationFunction function : values()) {
            if (function != PERCENTILE && function.value.equals(lower)) {
                return function;
            }
        }
        return null;
    }

    /**
     * @return N for {@code pN}/{@code percN} with N in 1..99, otherwise null
     */
    public static Integer percentileOf(String name) {
        Matcher matcher = PERCENTILE_NAME.matcher(name.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            return null;
        }
        int n = Integer.parseInt(matcher.group(1));
        return n >= 1 && n <= 99 ? n : null;
    }
}
