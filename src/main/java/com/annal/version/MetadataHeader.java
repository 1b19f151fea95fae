package com.annal.version;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The versioning header embedded in every live record. Instances are never
 * modified; each write builds the next header from the stored one through
 * {@link #created}, {@link #patched} or {@link #snapshotted}.
 *
 * @param previousDelta id of the newest delta entry of the record
 * @param version       current version
 * @param transition    kind of write that produced this header
 * @param created       first write, never overwritten
 * @param updated       latest write
 * @param deleted       soft-deletion mark, {@code null} while the record is live
 */
public record MetadataHeader(String previousDelta,
                             Version version,
                             Transition transition,
                             Stamp created,
                             Stamp updated,
                             Stamp deleted) {

    public MetadataHeader {
        if (version == null || transition == null) {
            throw new IllegalArgumentException("version and transition must be non-null");
        }
    }

    static MetadataHeader created(String originDelta, Instant now, Map<String, Object> metadata) {
        Stamp stamp = new Stamp(now, metadata);
        return new MetadataHeader(originDelta, Version.INITIAL, Transition.CREATED, stamp, stamp, null);
    }

    MetadataHeader patched(String deltaId, Instant now, Map<String, Object> metadata) {
        return new MetadataHeader(deltaId, version.nextMinor(), Transition.PATCHED,
                createdOr(now), new Stamp(now, metadata), null);
    }

    MetadataHeader snapshotted(String deltaId, Instant now, Map<String, Object> metadata) {
        return new MetadataHeader(deltaId, version.nextMajor(), Transition.SNAPSHOTTED,
                createdOr(now), new Stamp(now, metadata), null);
    }

    /** Caller metadata of the current version. */
    Map<String, Object> versionMetadata() {
        return updated == null ? null : updated.metadata();
    }

    boolean isDeleted() {
        return deleted != null;
    }

    private Stamp createdOr(Instant now) {
        return created != null ? created : new Stamp(now, null);
    }

    Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(MetadataFields.PREVIOUS_DELTA, previousDelta);
        fields.put(MetadataFields.VERSION, version.toFields());
        fields.put(MetadataFields.TRANSITION, transition.tag());
        fields.put(MetadataFields.CREATED, created == null ? null : created.toFields());
        fields.put(MetadataFields.UPDATED, updated == null ? null : updated.toFields());
        fields.put(MetadataFields.DELETED, deleted == null ? null : deleted.toFields());
        return fields;
    }

    /**
     * Reads a stored header. Headers written without a transition tag get one
     * inferred from the version.
     */
    static MetadataHeader fromFields(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("malformed metadata header: " + value);
        }
        Version version = Version.fromFields(map.get(MetadataFields.VERSION));
        Object tag = map.get(MetadataFields.TRANSITION);
        Transition transition;
        if (tag instanceof String s) {
            transition = Transition.fromTag(s);
        } else if (version.minor() > 0) {
            transition = Transition.PATCHED;
        } else {
            transition = version.major() <= 1 ? Transition.CREATED : Transition.SNAPSHOTTED;
        }
        Object previous = map.get(MetadataFields.PREVIOUS_DELTA);
        return new MetadataHeader(
                previous == null ? null : previous.toString(),
                version,
                transition,
                Stamp.fromFields(map.get(MetadataFields.CREATED)),
                Stamp.fromFields(map.get(MetadataFields.UPDATED)),
                Stamp.fromFields(map.get(MetadataFields.DELETED)));
    }
}
