package com.lognog.query.web;

import com.lognog.query.schema.FieldType;

import java.util.Map;

/**
 * Field names the query editor offers: schema columns, aliases and the
 * severity names a query may use instead of codes.
 */
public class FieldReference {
    private final Map<String, FieldType> fields;
    private final Map<String, String> aliases;
    private final Map<String, Integer> severityLevels;

    public FieldReference(Map<String, FieldType> fields, Map<String, String> aliases,
                          Map<String, Integer> severityLevels) {
        this.fields = fields;
        this.aliases = aliases;
        this.severityLevels = severityLevels;
    }

    public Map<String, FieldType> getFields() {
        return fields;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    public Map<String, Integer> getSeverityLevels() {
        return severityLevels;
    }
}
