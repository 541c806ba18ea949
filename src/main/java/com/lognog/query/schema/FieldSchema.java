package com.lognog.query.schema;

import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The canonical fields of the log store, in column order, with their types.
 * Supplied by the storage layer; the compiler only reads it.
 */
public final class FieldSchema {

    public static final String DEFAULT_TIMESTAMP_FIELD = "timestamp";
    public static final String DEFAULT_SEVERITY_FIELD = "severity";

    private static final FieldSchema DEFAULT_LOG_SCHEMA = builder()
        .field("timestamp", FieldType.DATETIME)
        .field("hostname", FieldType.STRING)
        .field("app_name", FieldType.STRING)
        .field("severity", FieldType.INTEGER)
        .field("message", FieldType.STRING)
        .field("index_name", FieldType.STRING)
        .field("facility", FieldType.INTEGER)
        .field("priority", FieldType.INTEGER)
        .field("source_ip", FieldType.STRING)
        .field("dest_ip", FieldType.STRING)
        .field("source_port", FieldType.INTEGER)
        .field("dest_port", FieldType.INTEGER)
        .field("protocol", FieldType.STRING)
        .field("user", FieldType.STRING)
        .field("raw", FieldType.STRING)
        .field("structured_data", FieldType.STRING)
        .build();

    private final ImmutableMap<String, FieldType> fields;
    private final String timestampField;
    private final String severityField;

    private FieldSchema(ImmutableMap<String, FieldType> fields, String timestampField, String severityField) {
        this.fields = fields;
        this.timestampField = timestampField;
        this.severityField = severityField;
    }

    /**
     * Schema of the LogNog log table.
     */
    public static FieldSchema defaultLogSchema() {
        return DEFAULT_LOG_SCHEMA;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    /**
     * @return the field's type, or null when the schema does not declare it
     */
    public FieldType typeOf(String name) {
        return fields.get(name);
    }

    public Map<String, FieldType> getFields() {
        return fields;
    }

    public List<String> getFieldNames() {
        return fields.keySet().asList();
    }

    public String getTimestampField() {
        return timestampField;
    }

    /**
     * @return the field holding syslog severity codes, or null when the schema has none
     */
    public String getSeverityField() {
        return severityField;
    }

    public static final class Builder {
        private final ImmutableMap.Builder<String, FieldType> fields = ImmutableMap.builder();
        private String timestampField = DEFAULT_TIMESTAMP_FIELD;
        private String severityField = DEFAULT_SEVERITY_FIELD;

        public Builder field(String name, FieldType type) {
            fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(type, "type"));
            return this;
        }

        public Builder fields(Map<String, FieldType> more) {
            more.forEach(this::field);
            return this;
        }

        public Builder timestampField(String name) {
            this.timestampField = name;
            return this;
        }

        public Builder severityField(String name) {
            this.severityField = name;
            return this;
        }

        public FieldSchema build() {
            ImmutableMap<String, FieldType> built = fields.buildOrThrow();
            if (built.get(timestampField) != FieldType.DATETIME) {
                throw new IllegalStateException(
                    "Timestamp field '" + timestampField + "' must be declared with type datetime");
            }
            String severity = severityField;
            if (severity != null && !built.containsKey(severity)) {
                severity = null;
            } else if (severity != null && !built.get(severity).isNumeric()) {
                throw new IllegalStateException("Severity field '" + severity + "' must be numeric");
            }
            return new FieldSchema(built, timestampField, severity);
        }
    }
}
