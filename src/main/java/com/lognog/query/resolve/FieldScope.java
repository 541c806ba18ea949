package com.lognog.query.resolve;

import com.google.common.collect.ImmutableMap;
import com.lognog.query.ast.FieldName;
import com.lognog.query.schema.FieldSchema;
import com.lognog.query.schema.FieldType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fields visible at one point of a pipeline, in output order.
 * Immutable; every change returns a new scope.
 */
public final class FieldScope {

    private final ImmutableMap<String, FieldType> fields;

    private FieldScope(Map<String, FieldType> fields) {
        this.fields = ImmutableMap.copyOf(fields);
    }

    public static FieldScope of(FieldSchema schema) {
        return new FieldScope(schema.getFields());
    }

    public static FieldScope of(Map<String, FieldType> fields) {
        return new FieldScope(fields);
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    /**
     * @return the field's type, or null when it is not visible
     */
    public FieldType typeOf(String name) {
        return fields.get(name);
    }

    public List<String> names() {
        return fields.keySet().asList();
    }

    public Map<String, FieldType> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    /**
     * Add a field at the end, or retype it in place when it already exists.
     */
    public FieldScope with(String name, FieldType type) {
        Map<String, FieldType> copy = new LinkedHashMap<>(fields);
        copy.put(name, type);
        return new FieldScope(copy);
    }

    public FieldScope without(String name) {
        Map<String, FieldType> copy = new LinkedHashMap<>(fields);
        copy.remove(name);
        return new FieldScope(copy);
    }

    /**
     * Rename a field in place. A different field already called {@code to}
     * is dropped.
     */
    public FieldScope renamed(String from, String to) {
        Map<String, FieldType> copy = new LinkedHashMap<>();
        for (Map.Entry<String, FieldType> entry : fields.entrySet()) {
            if (entry.getKey().equals(from)) {
                copy.put(to, entry.getValue());
            } else if (!entry.getKey().equals(to)) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return new FieldScope(copy);
    }

    /**
     * Keep only {@code names}, in that order.
     *
     * @throws ResolveException at the first field that is not visible
     */
    public FieldScope select(List<FieldName> names) {
        Map<String, FieldType> copy = new LinkedHashMap<>();
        for (FieldName name : names) {
            FieldType type = fields.get(name.getName());
            if (type == null) {
                throw new ResolveException("Field '" + name.getName() + "' is not available here",
                    name.getPosition());
            }
            copy.put(name.getName(), type);
        }
        return new FieldScope(copy);
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
