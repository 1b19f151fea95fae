package com.annal.version;

/**
 * Field names used inside the internal metadata sub-document of live records
 * and delta entries.
 */
final class MetadataFields {
    static final String PREVIOUS_DELTA = "previous_delta";
    static final String VERSION = "version";
    static final String MAJOR = "major";
    static final String MINOR = "minor";
    static final String TRANSITION = "transition";
    static final String CREATED = "created";
    static final String UPDATED = "updated";
    static final String DELETED = "deleted";
    static final String TIMESTAMP = "timestamp";
    static final String METADATA = "metadata";
    static final String TYPE = "type";
    static final String DELTAS = "deltas";

    // reverse delta payload
    static final String ADDED = "added";
    static final String CHANGED = "updated";
    static final String REMOVED = "removed";

    private MetadataFields() {
    }
}
