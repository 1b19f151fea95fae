package com.annal.version;

import com.annal.store.Documents;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * A field-level reverse delta. Applied to the state a write produced, it
 * restores the state that write replaced: {@code added} and {@code updated}
 * fields are set back to their old values and {@code removed} fields are dropped.
 */
public record Deltas(Map<String, Object> added, Map<String, Object> updated, Set<String> removed) {
    public static final Deltas EMPTY = new Deltas(Map.of(), Map.of(), Set.of());

    public Deltas {
        added = Collections.unmodifiableMap(Documents.deepCopy(added == null ? Map.of() : added));
        updated = Collections.unmodifiableMap(Documents.deepCopy(updated == null ? Map.of() : updated));
        removed = Collections.unmodifiableSet(new LinkedHashSet<>(removed == null ? Set.of() : removed));
    }

    public boolean isEmpty() {
        return added.isEmpty() && updated.isEmpty() && removed.isEmpty();
    }

    /**
     * Applies this delta to a working copy in place. A removal naming a field
     * the working copy does not have is logged and skipped.
     */
    public void applyTo(Map<String, Object> working, Logger logger) {
        for (var entry : added.entrySet()) {
            working.put(entry.getKey(), Documents.deepCopyValue(entry.getValue()));
        }
        for (var entry : updated.entrySet()) {
            working.put(entry.getKey(), Documents.deepCopyValue(entry.getValue()));
        }
        for (String field : removed) {
            if (!working.containsKey(field)) {
                logger.warning("Field '" + field + "' marked for removal is absent from the reconstructed record, skipping");
            } else {
                working.remove(field);
            }
        }
    }

    Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(MetadataFields.ADDED, added);
        fields.put(MetadataFields.CHANGED, updated);
        fields.put(MetadataFields.REMOVED, new ArrayList<>(removed));
        return fields;
    }

    @SuppressWarnings("unchecked")
    static Deltas fromFields(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("malformed deltas: " + value);
        }
        Object added = map.get(MetadataFields.ADDED);
        Object updated = map.get(MetadataFields.CHANGED);
        Object removed = map.get(MetadataFields.REMOVED);
        Set<String> removedNames = new LinkedHashSet<>();
        if (removed instanceof Collection<?> names) {
            for (Object name : names) {
                removedNames.add(String.valueOf(name));
            }
        }
        return new Deltas(
                added instanceof Map ? (Map<String, Object>) added : null,
                updated instanceof Map ? (Map<String, Object>) updated : null,
                removedNames);
    }
}
