package com.annal.version;

import com.annal.query.Filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Declares a versioned record type: the name of its live collection and the
 * ordered primary-key fields that identify one logical record.
 */
public final class RecordType {
    private static final String DELTAS_SUFFIX = "_deltas";

    private final String name;
    private final List<String> primaryKeyFields;

    public RecordType(String name, List<String> primaryKeyFields) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("record type name must be non-blank");
        }
        if (primaryKeyFields == null || primaryKeyFields.isEmpty()) {
            throw new ConfigurationException(name + " is missing its primary-key fields");
        }
        if (primaryKeyFields.stream().anyMatch(f -> f == null || f.isBlank())) {
            throw new ConfigurationException(name + " declares a blank primary-key field");
        }
        if (new LinkedHashSet<>(primaryKeyFields).size() != primaryKeyFields.size()) {
            throw new ConfigurationException(name + " declares duplicate primary-key fields: " + primaryKeyFields);
        }
        this.name = name;
        this.primaryKeyFields = List.copyOf(primaryKeyFields);
    }

    public static RecordType of(String name, String... primaryKeyFields) {
        return new RecordType(name, primaryKeyFields == null ? null : Arrays.asList(primaryKeyFields));
    }

    public String name() {
        return name;
    }

    /** Name of the paired append-only collection holding the delta chain. */
    public String deltasCollection() {
        return name + DELTAS_SUFFIX;
    }

    public List<String> primaryKeyFields() {
        return primaryKeyFields;
    }

    /**
     * Extracts the primary-key fields, in declaration order.
     *
     * @throws KeyConsistencyException if a key field is absent
     */
    public Map<String, Object> keyOf(Map<String, ?> record) {
        Map<String, Object> key = new LinkedHashMap<>();
        for (String field : primaryKeyFields) {
            if (record == null || !record.containsKey(field)) {
                throw KeyConsistencyException.missing(field, name);
            }
            key.put(field, record.get(field));
        }
        return key;
    }

    /** Filter selecting documents with the same primary key as the record. */
    public Filter filterFor(Map<String, ?> record) {
        List<Filter> parts = new ArrayList<>();
        keyOf(record).forEach((field, value) -> parts.add(Filter.eq(field, value)));
        return Filter.and(parts);
    }

    public String describeKey(Map<String, ?> record) {
        return name + keyOf(record);
    }

    @Override
    public String toString() {
        return "RecordType[" + name + ", key=" + primaryKeyFields + "]";
    }
}
