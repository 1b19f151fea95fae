package com.annal.version;

import com.annal.store.Document;
import com.annal.store.Documents;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field-level comparison of two versions of a record. In every method
 * {@code a} is the newer record and {@code b} the older one, so the results
 * describe how to turn {@code a} back into {@code b}.
 * <p>
 * {@code _id} and the internal metadata field are always ignored.
 */
public class DiffEngine {
    private final RecordType recordType;
    private final String metadataKey;

    public DiffEngine(RecordType recordType, String metadataKey) {
        this.recordType = recordType;
        this.metadataKey = metadataKey;
    }

    /** Fields present in {@code b} but not in {@code a}, with their values from {@code b}. */
    public Map<String, Object> additions(Map<String, ?> a, Map<String, ?> b, Collection<String> ignoreFields) {
        checkKeys(a, b);
        Set<String> ignored = ignored(ignoreFields);
        Map<String, Object> result = new LinkedHashMap<>();
        for (var entry : b.entrySet()) {
            if (!ignored.contains(entry.getKey()) && !a.containsKey(entry.getKey())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /** Names of fields present in {@code a} but not in {@code b}. */
    public Set<String> removals(Map<String, ?> a, Map<String, ?> b, Collection<String> ignoreFields) {
        checkKeys(a, b);
        Set<String> ignored = ignored(ignoreFields);
        Set<String> result = new LinkedHashSet<>();
        for (String field : a.keySet()) {
            if (!ignored.contains(field) && !b.containsKey(field)) {
                result.add(field);
            }
        }
        return result;
    }

    /** Fields present in both whose value differs, with their values from {@code b}. */
    public Map<String, Object> updates(Map<String, ?> a, Map<String, ?> b, Collection<String> ignoreFields) {
        Set<String> ignored = ignored(ignoreFields);
        Map<String, Object> result = new LinkedHashMap<>();
        for (var entry : b.entrySet()) {
            String field = entry.getKey();
            if (!ignored.contains(field) && a.containsKey(field)
                    && !Documents.valuesEqual(a.get(field), entry.getValue())) {
                result.put(field, entry.getValue());
            }
        }
        return result;
    }

    /**
     * The reverse delta that turns {@code newer} back into {@code older}.
     */
    public Deltas diff(Map<String, ?> newer, Map<String, ?> older, Collection<String> ignoreFields) {
        return new Deltas(
                additions(newer, older, ignoreFields),
                updates(newer, older, ignoreFields),
                removals(newer, older, ignoreFields));
    }

    /**
     * Verifies that every record carries each primary-key field and that they
     * all agree on its value.
     */
    @SafeVarargs
    public final void checkKeys(Map<String, ?>... records) {
        for (String field : recordType.primaryKeyFields()) {
            List<Object> values = new ArrayList<>();
            for (Map<String, ?> record : records) {
                if (!record.containsKey(field)) {
                    throw KeyConsistencyException.missing(field, recordType.name());
                }
                values.add(record.get(field));
            }
            for (Object value : values) {
                if (!Documents.valuesEqual(values.get(0), value)) {
                    throw KeyConsistencyException.mismatch(field, values);
                }
            }
        }
    }

    private Set<String> ignored(Collection<String> ignoreFields) {
        Set<String> ignored = new LinkedHashSet<>();
        if (ignoreFields != null) {
            ignored.addAll(ignoreFields);
        }
        ignored.add(Document.ID_FIELD);
        ignored.add(metadataKey);
        return ignored;
    }
}
