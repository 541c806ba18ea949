package com.lognog.query.resolve;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;

/**
 * User-facing field names and the canonical columns they stand for.
 * Lookups ignore case.
 */
public final class FieldAliases {

    private static final ImmutableMap<String, String> ALIASES = ImmutableMap.<String, String>builder()
        .put("host", "hostname")
        .put("source", "hostname")
        .put("app", "app_name")
        .put("program", "app_name")
        .put("sourcetype", "app_name")
        .put("level", "severity")
        .put("msg", "message")
        .put("_raw", "raw")
        .put("_time", "timestamp")
        .put("time", "timestamp")
        .put("index", "index_name")
        .buildOrThrow();

    private FieldAliases() {
    }

    /**
     * @return the canonical name for an alias, or null when {@code name} is not one
     */
    public static String canonicalOf(String name) {
        return ALIASES.get(name.toLowerCase(Locale.ROOT));
    }

    public static Map<String, String> asMap() {
        return ALIASES;
    }
}
