package com.annal.version;

import com.annal.store.Documents;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * When something happened to a record, and the caller metadata supplied with it.
 *
 * @param metadata caller metadata, may be {@code null}
 */
public record Stamp(Instant timestamp, Map<String, Object> metadata) {

    public Stamp {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must be non-null");
        }
        metadata = metadata == null ? null : Collections.unmodifiableMap(Documents.deepCopy(metadata));
    }

    Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(MetadataFields.TIMESTAMP, timestamp);
        fields.put(MetadataFields.METADATA, metadata);
        return fields;
    }

    @SuppressWarnings("unchecked")
    static Stamp fromFields(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map && map.get(MetadataFields.TIMESTAMP) instanceof Instant at) {
            Object meta = map.get(MetadataFields.METADATA);
            return new Stamp(at, meta instanceof Map ? (Map<String, Object>) meta : null);
        }
        throw new IllegalArgumentException("malformed stamp: " + value);
    }
}
