package com.annal.version;

import com.annal.query.Filter;
import com.annal.store.Document;
import com.annal.store.DocumentStore;
import com.annal.store.UpdateResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Applies a batch of records one at a time and optionally soft-deletes the
 * live records the batch no longer contains. Each record is its own
 * transaction; a failure stops the batch with the earlier records kept.
 */
class BulkPatchCoordinator {
    private final DocumentStore store;
    private final RecordType recordType;
    private final PatchOrchestrator orchestrator;
    private final String metadataKey;
    private final Clock clock;
    private final Logger logger;

    BulkPatchCoordinator(DocumentStore store, RecordType recordType, PatchOrchestrator orchestrator,
                         String metadataKey, Clock clock, Logger logger) {
        this.store = store;
        this.recordType = recordType;
        this.orchestrator = orchestrator;
        this.metadataKey = metadataKey;
        this.clock = clock;
        this.logger = logger;
    }

    BulkPatchResult patchMany(Collection<Document> records, BulkPatchOptions options) {
        // every key is checked before the first write
        for (Document record : records) {
            recordType.keyOf(record.getFields());
        }
        PatchOptions patchOptions = PatchOptions.defaults().withMetadata(options.metadata());
        List<PatchOutcome> outcomes = new ArrayList<>();
        for (Document record : records) {
            Optional<PatchOutcome> outcome = orchestrator.patch(record, patchOptions);
            outcome.ifPresent(outcomes::add);
        }
        long marked = options.missingMarkDeleted() ? markMissingDeleted(records, options) : 0;
        return new BulkPatchResult(outcomes, marked);
    }

    /**
     * Marks live records whose primary key matches none of the batch records.
     * Already-deleted records keep their original mark, and no delta entry is
     * written since the tracked fields do not change.
     */
    private long markMissingDeleted(Collection<Document> records, BulkPatchOptions options) {
        List<Filter> present = new ArrayList<>();
        for (Document record : records) {
            present.add(recordType.filterFor(record.getFields()));
        }
        String deletedPath = metadataKey + "." + MetadataFields.DELETED;
        Filter missing = Filter.and(
                Filter.exists(metadataKey),
                Filter.not(Filter.or(present)),
                Filter.isNull(deletedPath + "." + MetadataFields.TIMESTAMP),
                options.missingMarkDeletedFilter());

        List<Object> ids = new ArrayList<>();
        for (Document doc : store.find(recordType.name(), missing)) {
            ids.add(doc.getId());
        }
        if (ids.isEmpty()) {
            return 0;
        }
        Stamp stamp = new Stamp(clock.instant(), options.metadata());
        UpdateResult result = store.updateMany(recordType.name(), Filter.in(Document.ID_FIELD, ids),
                Map.of(deletedPath, stamp.toFields()));
        logger.info("Marked " + result.modifiedCount() + " " + recordType.name() + " records deleted");
        return result.modifiedCount();
    }
}
