package com.lognog.query.ast;

import java.util.Locale;

/**
 * Time units accepted in a bin or timechart span.
 */
public enum SpanUnit {

    SECOND("s", "SECOND", 1L),
    MINUTE("m", "MINUTE", 60L),
    HOUR("h", "HOUR", 3_600L),
    DAY("d", "DAY", 86_400L),
    WEEK("w", "WEEK", 604_800L);

    private final String suffix;
    private final String sqlName;
    private final long seconds;

    SpanUnit(String suffix, String sqlName, long seconds) {
        this.suffix = suffix;
        this.sqlName = sqlName;
        this.seconds = seconds;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Unit keyword of an SQL {@code INTERVAL}.
     */
    public String getSqlName() {
        return sqlName;
    }

    public long getSeconds() {
        return seconds;
    }

    /**
     * @return the unit for a span suffix, or null when there is none
     */
    public static SpanUnit fromSuffix(String suffix) {
        String lower = suffix.toLowerCase(Locale.ROOT);
        for (SpanUnit unit : values()) {
            if (unit.suffix.equals(lower)) {
                return unit;
            }
        }
        return null;
    }
}
