package io.collector.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Flat record produced for one item: field name to value, in insertion order.
 * The record has no fixed shape; the sink projects it onto its schema on write.
 */
public final class Record {
    private final Map<String, Object> fields;

    private Record(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static Record empty() {
        return new Record(new LinkedHashMap<>());
    }

    public static Record of(Map<String, ?> fields) {
        Record r = empty();
        fields.forEach(r::put);
        return r;
    }

    public Record put(String field, Object value) {
        fields.put(Objects.requireNonNull(field, "field"), value);
        return this;
    }

    public boolean has(String field) { return fields.containsKey(field); }

    /** Empty when the field is absent or explicitly null. */
    public Optional<Object> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    /** Text form of the field as it is written to a CSV cell; empty when absent. */
    public String text(String field) {
        return textOf(fields.get(field));
    }

    /**
     * JSON scalars as their plain text, JSON objects and arrays as compact JSON, null and missing as empty.
     */
    public static String textOf(Object value) {
        if (value == null) return "";
        if (value instanceof JsonNode node) {
            if (node.isNull() || node.isMissingNode()) return "";
            return node.isValueNode() ? node.asText() : node.toString();
        }
        return value.toString();
    }

    public Map<String, Object> fields() { return Collections.unmodifiableMap(fields); }
    public int size() { return fields.size(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Record" + fields;
    }
}
