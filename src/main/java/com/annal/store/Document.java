package com.annal.store;

import java.util.Collections;
import java.util.Map;

/**
 * Represents a single schemaless document stored in a collection.
 * The field map is deep-copied on construction and exposed read-only.
 */
public class Document {
    public static final String ID_FIELD = "_id";

    private final Map<String, Object> fields;

    public Document(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        this.fields = Collections.unmodifiableMap(Documents.deepCopy(fields));
    }

    public String getId() {
        Object id = fields.get(ID_FIELD);
        return id == null ? null : id.toString();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Reads a nested value using dot notation, e.g. {@code address.city} or {@code tags.0}.
     */
    public Object getPath(String path) {
        return Documents.getPath(fields, path);
    }

    public boolean containsKey(String field) {
        return fields.containsKey(field);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    /** Returns a deep, mutable copy of the fields. */
    public Map<String, Object> toMutableMap() {
        return Documents.deepCopy(fields);
    }

    public Document withId(String id) {
        Map<String, Object> copy = toMutableMap();
        copy.put(ID_FIELD, id);
        return new Document(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Document" + fields;
    }
}
