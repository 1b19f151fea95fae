package com.annal.version;

import com.annal.query.Filter;
import com.annal.store.Document;
import com.annal.store.DocumentStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A versioned collection of one {@link RecordType}.
 * <p>
 * The live collection holds the current state of every record, each carrying
 * a metadata header. A paired {@code <name>_deltas} collection holds an
 * append-only chain of reverse deltas and periodic full snapshots, from which
 * any earlier state can be rebuilt by time or by version.
 */
public class HistoricalCollection {
    private static final Logger LOGGER = Logger.getLogger(HistoricalCollection.class.getName());

    private final DocumentStore store;
    private final RecordType recordType;
    private final VersioningConfig config;
    private final Logger logger;
    private final PatchOrchestrator orchestrator;
    private final BulkPatchCoordinator bulk;
    private final TimestampChainWalker timestampWalker;
    private final VersionChainWalker versionWalker;

    public HistoricalCollection(DocumentStore store, RecordType recordType) {
        this(store, recordType, VersioningConfig.defaults());
    }

    public HistoricalCollection(DocumentStore store, RecordType recordType, VersioningConfig config) {
        this(store, recordType, config, Clock.systemUTC(), LOGGER);
    }

    public HistoricalCollection(DocumentStore store, RecordType recordType, VersioningConfig config,
                                Clock clock, Logger logger) {
        if (recordType == null) {
            throw new ConfigurationException("a record type with primary-key fields is required");
        }
        if (store == null || config == null || clock == null) {
            throw new ConfigurationException("store, config and clock must be non-null");
        }
        this.store = store;
        this.recordType = recordType;
        this.config = config;
        this.logger = logger == null ? LOGGER : logger;
        String metadataKey = config.internalMetadataKeyname();
        DiffEngine diffEngine = new DiffEngine(recordType, metadataKey);
        this.orchestrator = new PatchOrchestrator(store, recordType, config, diffEngine, clock, this.logger);
        this.bulk = new BulkPatchCoordinator(store, recordType, orchestrator, metadataKey, clock, this.logger);
        this.timestampWalker = new TimestampChainWalker(store, recordType, metadataKey, this.logger);
        this.versionWalker = new VersionChainWalker(store, recordType, metadataKey, this.logger);
    }

    public String name() {
        return recordType.name();
    }

    public String deltasCollection() {
        return recordType.deltasCollection();
    }

    public RecordType recordType() {
        return recordType;
    }

    public VersioningConfig config() {
        return config;
    }

    public Optional<PatchOutcome> patchOne(Document record) {
        return patchOne(record, PatchOptions.defaults());
    }

    /**
     * Writes a record, creating it on first sight. An unchanged record is
     * skipped unless {@link PatchOptions#force()} is set.
     *
     * @return what was written, or empty when nothing was
     * @throws KeyConsistencyException if a primary-key field is missing
     */
    public Optional<PatchOutcome> patchOne(Document record, PatchOptions options) {
        requireRecord(record, "patchOne");
        try {
            return orchestrator.patch(record, options == null ? PatchOptions.defaults() : options);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to patch " + recordType.name() + " record", e);
            throw e;
        }
    }

    public BulkPatchResult patchMany(Collection<Document> records) {
        return patchMany(records, BulkPatchOptions.defaults());
    }

    public BulkPatchResult patchMany(Collection<Document> records, BulkPatchOptions options) {
        if (records == null) {
            logger.severe("patchMany called with null records");
            throw new IllegalArgumentException("records must be non-null");
        }
        try {
            return bulk.patchMany(records, options == null ? BulkPatchOptions.defaults() : options);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to patch " + recordType.name() + " batch", e);
            throw e;
        }
    }

    /**
     * Removes a record and its whole delta chain. History is not kept.
     */
    public Erasure deleteDocAndPatches(Document record) {
        requireRecord(record, "deleteDocAndPatches");
        Filter filter = recordType.filterFor(record.getFields());
        try {
            Erasure erasure = store.runInTransaction(session -> new Erasure(
                    session.deleteMany(recordType.name(), filter).deletedCount(),
                    session.deleteMany(recordType.deltasCollection(), filter).deletedCount()),
                    config.transactionOptions());
            logger.info("Erased " + recordType.describeKey(record.getFields()) + ": " + erasure.recordsDeleted()
                    + " records, " + erasure.deltasDeleted() + " delta entries");
            return erasure;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to erase " + recordType.name() + " record", e);
            throw e;
        }
    }

    /**
     * The record's fields as they were at the given instant, without
     * {@code _id} or the metadata header. Empty when the record is unknown or
     * did not exist yet.
     */
    public Optional<Document> getRevisionByDate(Document record, Instant atTime) {
        requireRecord(record, "getRevisionByDate");
        if (atTime == null) {
            throw new IllegalArgumentException("atTime must be non-null");
        }
        try {
            return timestampWalker.asOf(record, atTime);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to rebuild " + recordType.name() + " record at " + atTime, e);
            throw e;
        }
    }

    /**
     * The first record of this type found at the given version, searched
     * across all records. Use {@link #getRevisionByVersion(Document, int, int)}
     * to look up one record.
     */
    public Optional<Document> getRevisionByVersion(int major, int minor) {
        return revisionByVersion(Filter.all(), major, minor);
    }

    /**
     * The record at the given version, with a reduced header holding the
     * version and its caller metadata.
     */
    public Optional<Document> getRevisionByVersion(Document record, int major, int minor) {
        requireRecord(record, "getRevisionByVersion");
        return revisionByVersion(recordType.filterFor(record.getFields()), major, minor);
    }

    private Optional<Document> revisionByVersion(Filter scope, int major, int minor) {
        try {
            return versionWalker.asOfVersion(scope, new Version(major, minor));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to rebuild " + recordType.name() + " version " + major + "." + minor, e);
            throw e;
        }
    }

    public Optional<Document> findCurrent(Document record) {
        requireRecord(record, "findCurrent");
        return store.findOne(recordType.name(), recordType.filterFor(record.getFields()));
    }

    /**
     * Lists the record's history, the live version first and then every delta
     * entry from newest to oldest.
     */
    public List<Revision> revisions(Document record) {
        requireRecord(record, "revisions");
        String metadataKey = config.internalMetadataKeyname();
        Optional<Document> live = findCurrent(record);
        if (live.isEmpty() || !live.get().containsKey(metadataKey)) {
            return List.of();
        }
        MetadataHeader header = MetadataHeader.fromFields(live.get().get(metadataKey));
        List<Revision> revisions = new ArrayList<>();
        revisions.add(new Revision(live.get().getId(), Revision.Kind.LIVE, header.version(),
                header.updated() == null ? null : header.updated().timestamp(), header.versionMetadata()));

        DeltaChain chain = new DeltaChain(store, recordType, metadataKey, logger);
        String deltaId = header.previousDelta();
        while (deltaId != null) {
            Optional<DeltaEntry> entry = chain.load(deltaId);
            if (entry.isEmpty()) {
                break;
            }
            DeltaEntry e = entry.get();
            revisions.add(new Revision(e.id(), e.isSnapshot() ? Revision.Kind.SNAPSHOT : Revision.Kind.PATCH,
                    e.version(), e.timestamp(), e.metadata()));
            deltaId = e.previousDelta();
        }
        return revisions;
    }

    private void requireRecord(Document record, String operation) {
        if (record == null) {
            logger.severe(operation + " called with null record");
            throw new IllegalArgumentException("record must be non-null");
        }
    }
}
