package com.annal.version;

import com.annal.store.Document;
import com.annal.store.DocumentStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Rebuilds a record as it was at a point in time by walking its delta chain
 * backward from the live record.
 * <p>
 * Entries stamped at or after the requested time belong to writes that had
 * not happened yet, so their reverse deltas are collected. The first entry
 * stamped before it ends the walk: a snapshot there already holds the state
 * in effect, while a patch there describes a write that was already applied.
 * Snapshots met on the way reset the base, since they hold a full field set.
 */
class TimestampChainWalker {
    private final DocumentStore store;
    private final RecordType recordType;
    private final String metadataKey;
    private final Logger logger;

    TimestampChainWalker(DocumentStore store, RecordType recordType, String metadataKey, Logger logger) {
        this.store = store;
        this.recordType = recordType;
        this.metadataKey = metadataKey;
        this.logger = logger;
    }

    Optional<Document> asOf(Document record, Instant atTime) {
        Optional<Document> found = store.findOne(recordType.name(), recordType.filterFor(record.getFields()));
        if (found.isEmpty() || !found.get().containsKey(metadataKey)) {
            return Optional.empty();
        }
        Document live = found.get();
        MetadataHeader header = MetadataHeader.fromFields(live.get(metadataKey));
        if (header.created() != null && header.created().timestamp().isAfter(atTime)) {
            return Optional.empty();
        }

        DeltaChain chain = new DeltaChain(store, recordType, metadataKey, logger);
        Map<String, Object> base = live.toMutableMap();
        List<Deltas> pending = new ArrayList<>();
        String deltaId = header.previousDelta();
        while (deltaId != null) {
            Optional<DeltaEntry> loaded = chain.load(deltaId);
            if (loaded.isEmpty()) {
                break;
            }
            DeltaEntry entry = loaded.get();
            if (entry.timestamp().isBefore(atTime)) {
                if (entry.isSnapshot()) {
                    base = entry.workingCopy();
                    pending.clear();
                }
                break;
            }
            if (entry.isSnapshot()) {
                base = entry.workingCopy();
                pending.clear();
            }
            if (entry.deltas() != null) {
                pending.add(entry.deltas());
            }
            deltaId = entry.previousDelta();
        }

        for (Deltas deltas : pending) {
            deltas.applyTo(base, logger);
        }
        base.remove(Document.ID_FIELD);
        base.remove(metadataKey);
        return Optional.of(new Document(base));
    }
}
