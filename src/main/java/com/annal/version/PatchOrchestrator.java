package com.annal.version;

import com.annal.query.Filter;
import com.annal.store.Document;
import com.annal.store.DocumentOperations;
import com.annal.store.DocumentStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Decides whether a write is a no-op, a patch or a checkpoint snapshot, and
 * performs it in one transaction: the new delta entry and the replaced live
 * record are committed together or not at all.
 * <p>
 * The transaction callback reads the stored record itself, so a retried
 * attempt always works from the state left by the conflicting writer.
 */
class PatchOrchestrator {
    private final DocumentStore store;
    private final RecordType recordType;
    private final VersioningConfig config;
    private final DiffEngine diffEngine;
    private final Clock clock;
    private final Logger logger;

    PatchOrchestrator(DocumentStore store, RecordType recordType, VersioningConfig config,
                      DiffEngine diffEngine, Clock clock, Logger logger) {
        this.store = store;
        this.recordType = recordType;
        this.config = config;
        this.diffEngine = diffEngine;
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * @return the outcome, or empty when the record was unchanged and not forced
     * @throws KeyConsistencyException if the record lacks a primary-key field; nothing is written
     */
    Optional<PatchOutcome> patch(Document incoming, PatchOptions options) {
        recordType.keyOf(incoming.getFields());
        return store.runInTransaction(session -> patchInSession(session, incoming, options),
                config.transactionOptions());
    }

    private Optional<PatchOutcome> patchInSession(DocumentOperations session, Document incoming, PatchOptions options) {
        String metadataKey = config.internalMetadataKeyname();
        Filter filter = recordType.filterFor(incoming.getFields());
        Optional<Document> stored = session.findOne(recordType.name(), filter);
        DeltaChain chain = new DeltaChain(session, recordType, metadataKey, logger);
        Instant now = clock.instant();

        if (stored.isEmpty() || stored.get().isEmpty() || !stored.get().containsKey(metadataKey)) {
            return Optional.of(create(session, chain, incoming, stored.orElse(null), now, options.metadata()));
        }

        Document latest = stored.get();
        MetadataHeader header = MetadataHeader.fromFields(latest.get(metadataKey));
        Deltas deltas = diffEngine.diff(incoming.getFields(), latest.getFields(), options.ignoreFields());
        if (deltas.isEmpty() && !options.force()) {
            logger.fine(() -> "No changes for " + recordType.describeKey(incoming.getFields()) + ", skipping write");
            return Optional.empty();
        }

        Map<String, Object> fields = recordFields(incoming);
        DeltaEntry entry;
        MetadataHeader next;
        if (snapshotWithinReach(chain, header.previousDelta())) {
            entry = DeltaEntry.patch(recordType.keyOf(fields), header, now, deltas);
            String deltaId = chain.insert(entry);
            next = header.patched(deltaId, now, options.metadata());
        } else {
            entry = DeltaEntry.checkpoint(fields, header, now, deltas);
            String deltaId = chain.insert(entry);
            next = header.snapshotted(deltaId, now, options.metadata());
            logger.fine(() -> "Checkpoint for " + recordType.describeKey(fields) + " at version " + next.version());
        }
        fields.put(metadataKey, next.toFields());
        session.replaceOne(recordType.name(), Filter.byId(latest.getId()), new Document(fields));
        return Optional.of(new PatchOutcome(next.transition(), latest.getId(), next.previousDelta(), next.version()));
    }

    private PatchOutcome create(DocumentOperations session, DeltaChain chain, Document incoming,
                                Document headerless, Instant now, Map<String, Object> metadata) {
        Map<String, Object> fields = recordFields(incoming);
        String originId = chain.insert(DeltaEntry.origin(fields, now));
        MetadataHeader header = MetadataHeader.created(originId, now, metadata);
        fields.put(config.internalMetadataKeyname(), header.toFields());

        String recordId;
        if (headerless != null && headerless.getId() != null) {
            session.replaceOne(recordType.name(), Filter.byId(headerless.getId()), new Document(fields));
            recordId = headerless.getId();
        } else {
            recordId = session.insertOne(recordType.name(), new Document(fields)).insertedId();
        }
        logger.fine(() -> "Created " + recordType.describeKey(fields) + " as " + recordId);
        return new PatchOutcome(Transition.CREATED, recordId, originId, header.version());
    }

    /**
     * Walks back at most {@code numDeltasBeforeSnapshot - 1} entries looking
     * for a snapshot. A chain that ends or breaks before the budget runs out
     * counts as reachable, so no checkpoint is forced on a truncated chain.
     */
    private boolean snapshotWithinReach(DeltaChain chain, String previousDelta) {
        String deltaId = previousDelta;
        if (deltaId == null) {
            return true;
        }
        for (int hops = 1; hops < config.numDeltasBeforeSnapshot(); hops++) {
            Optional<DeltaEntry> entry = chain.load(deltaId);
            if (entry.isEmpty() || entry.get().isSnapshot()) {
                return true;
            }
            deltaId = entry.get().previousDelta();
            if (deltaId == null) {
                return true;
            }
        }
        return false;
    }

    /** The incoming fields without store identity or a caller-supplied header. */
    private Map<String, Object> recordFields(Document incoming) {
        Map<String, Object> fields = incoming.toMutableMap();
        fields.remove(Document.ID_FIELD);
        fields.remove(config.internalMetadataKeyname());
        return fields;
    }
}
