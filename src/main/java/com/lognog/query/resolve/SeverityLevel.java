package com.lognog.query.resolve;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;

/**
 * The eight syslog severity levels. Queries may name a level instead of
 * its code; names are replaced by codes during resolution.
 */
public enum SeverityLevel {

    EMERGENCY(0, "emergency", "emerg"),
    ALERT(1, "alert"),
    CRITICAL(2, "critical", "crit"),
    ERROR(3, "error", "err"),
    WARNING(4, "warning", "warn"),
    NOTICE(5, "notice"),
    INFO(6, "info", "informational"),
    DEBUG(7, "debug");

    public static final int MIN_CODE = 0;
    public static final int MAX_CODE = 7;

    private final int code;
    private final String value;
    private final ImmutableList<String> names;

    SeverityLevel(int code, String value, String... synonyms) {
        this.code = code;
        this.value = value;
        this.names = ImmutableList.<String>builder().add(value).add(synonyms).build();
    }

    public int getCode() {
        return code;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Every accepted spelling, canonical name first.
     */
    public List<String> getNames() {
        return names;
    }

    /**
     * @return the level for a name or synonym in any case, or null
     */
    public static SeverityLevel fromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (SeverityLevel level : values()) {
            if (level.names.contains(lower)) {
                return level;
            }
        }
        return null;
    }
}
