package com.annal.version;

import com.annal.query.Filter;
import com.annal.store.Document;
import com.annal.store.DocumentOperations;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads delta entries of one record type through a store or a transaction
 * session. Entries that are missing or unreadable are reported as empty and
 * logged, never thrown, so chain walks can stop gracefully.
 */
final class DeltaChain {
    private final DocumentOperations operations;
    private final RecordType recordType;
    private final String metadataKey;
    private final Logger logger;

    DeltaChain(DocumentOperations operations, RecordType recordType, String metadataKey, Logger logger) {
        this.operations = operations;
        this.recordType = recordType;
        this.metadataKey = metadataKey;
        this.logger = logger;
    }

    Optional<DeltaEntry> load(String deltaId) {
        Optional<Document> found = operations.findOne(recordType.deltasCollection(), Filter.byId(deltaId));
        if (found.isEmpty()) {
            logger.warning("Delta entry " + deltaId + " of " + recordType.name() + " is missing; the chain is truncated there");
            return Optional.empty();
        }
        return parse(found.get());
    }

    /** The entry tagged with the given version within the scope. */
    Optional<DeltaEntry> tagged(Filter scope, Version version) {
        Filter filter = Filter.and(scope,
                Filter.eq(versionPath(MetadataFields.MAJOR), version.major()),
                Filter.eq(versionPath(MetadataFields.MINOR), version.minor()));
        return operations.findOne(recordType.deltasCollection(), filter).flatMap(this::parse);
    }

    /** The entry whose {@code previous_delta} points at the given id. */
    Optional<DeltaEntry> successorOf(String deltaId) {
        return operations.findOne(recordType.deltasCollection(), pointingAt(deltaId)).flatMap(this::parse);
    }

    /** The live record whose header points at the given id. */
    Optional<Document> liveRecordPointingAt(String deltaId) {
        return operations.findOne(recordType.name(), pointingAt(deltaId));
    }

    String insert(DeltaEntry entry) {
        return operations.insertOne(recordType.deltasCollection(), entry.toDocument(metadataKey)).insertedId();
    }

    private Filter pointingAt(String deltaId) {
        return Filter.eq(metadataKey + "." + MetadataFields.PREVIOUS_DELTA, deltaId);
    }

    private String versionPath(String component) {
        return metadataKey + "." + MetadataFields.VERSION + "." + component;
    }

    private Optional<DeltaEntry> parse(Document document) {
        try {
            return Optional.of(DeltaEntry.fromDocument(document, metadataKey));
        } catch (IllegalArgumentException e) {
            logger.log(Level.WARNING, "Unreadable delta entry " + document.getId() + " in " + recordType.deltasCollection(), e);
            return Optional.empty();
        }
    }
}
