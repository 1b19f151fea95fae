package com.annal.version;

import com.annal.store.Document;
import com.annal.store.Documents;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable node of a record's delta chain.
 * <p>
 * A {@link DeltaType#SNAPSHOT snapshot} holds a full field set. The origin
 * snapshot has no {@code previousDelta} and no deltas; a checkpoint snapshot
 * also keeps the reverse delta of the write that produced it. A
 * {@link DeltaType#PATCH patch} holds only the primary-key fields and its
 * reverse delta.
 *
 * @param id            store id, {@code null} until inserted
 * @param version       version the record had before the write that created this entry
 * @param timestamp     time of that write
 * @param metadata      caller metadata of {@code version}
 * @param deltas        reverse delta, {@code null} for the origin snapshot
 * @param recordFields  full fields for snapshots, primary-key fields for patches
 */
public record DeltaEntry(String id,
                         DeltaType type,
                         Version version,
                         Instant timestamp,
                         String previousDelta,
                         Map<String, Object> metadata,
                         Deltas deltas,
                         Map<String, Object> recordFields) {

    public DeltaEntry {
        if (type == null || version == null || timestamp == null) {
            throw new IllegalArgumentException("type, version and timestamp must be non-null");
        }
        if (type == DeltaType.PATCH && deltas == null) {
            throw new IllegalArgumentException("a patch entry needs deltas");
        }
        metadata = metadata == null ? null : Collections.unmodifiableMap(Documents.deepCopy(metadata));
        recordFields = Collections.unmodifiableMap(Documents.deepCopy(recordFields == null ? Map.of() : recordFields));
    }

    static DeltaEntry origin(Map<String, Object> fields, Instant timestamp) {
        return new DeltaEntry(null, DeltaType.SNAPSHOT, Version.ORIGIN, timestamp, null, null, null, fields);
    }

    static DeltaEntry checkpoint(Map<String, Object> fields, MetadataHeader stored, Instant timestamp, Deltas reverse) {
        return new DeltaEntry(null, DeltaType.SNAPSHOT, stored.version(), timestamp, stored.previousDelta(),
                stored.versionMetadata(), reverse, fields);
    }

    static DeltaEntry patch(Map<String, Object> keyFields, MetadataHeader stored, Instant timestamp, Deltas reverse) {
        return new DeltaEntry(null, DeltaType.PATCH, stored.version(), timestamp, stored.previousDelta(),
                stored.versionMetadata(), reverse, keyFields);
    }

    public boolean isSnapshot() {
        return type == DeltaType.SNAPSHOT;
    }

    public boolean isOrigin() {
        return previousDelta == null;
    }

    /** Mutable copy of the record fields, used as a reconstruction base. */
    Map<String, Object> workingCopy() {
        return Documents.deepCopy(recordFields);
    }

    Document toDocument(String metadataKey) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put(MetadataFields.TYPE, type.tag());
        header.put(MetadataFields.VERSION, version.toFields());
        header.put(MetadataFields.TIMESTAMP, timestamp);
        header.put(MetadataFields.PREVIOUS_DELTA, previousDelta);
        header.put(MetadataFields.METADATA, metadata);
        if (deltas != null) {
            header.put(MetadataFields.DELTAS, deltas.toFields());
        }
        Map<String, Object> fields = new LinkedHashMap<>(recordFields);
        if (id != null) {
            fields.put(Document.ID_FIELD, id);
        }
        fields.put(metadataKey, header);
        return new Document(fields);
    }

    @SuppressWarnings("unchecked")
    static DeltaEntry fromDocument(Document document, String metadataKey) {
        if (!(document.get(metadataKey) instanceof Map<?, ?> header)) {
            throw new IllegalArgumentException("delta entry " + document.getId() + " has no metadata header");
        }
        if (!(header.get(MetadataFields.TIMESTAMP) instanceof Instant timestamp)) {
            throw new IllegalArgumentException("delta entry " + document.getId() + " has no timestamp");
        }
        Map<String, Object> fields = document.toMutableMap();
        fields.remove(Document.ID_FIELD);
        fields.remove(metadataKey);
        Object previous = header.get(MetadataFields.PREVIOUS_DELTA);
        Object meta = header.get(MetadataFields.METADATA);
        Object deltas = header.get(MetadataFields.DELTAS);
        return new DeltaEntry(
                document.getId(),
                DeltaType.fromTag(header.get(MetadataFields.TYPE)),
                Version.fromFields(header.get(MetadataFields.VERSION)),
                timestamp,
                previous == null ? null : previous.toString(),
                meta instanceof Map ? (Map<String, Object>) meta : null,
                deltas == null ? null : Deltas.fromFields(deltas),
                fields);
    }
}
