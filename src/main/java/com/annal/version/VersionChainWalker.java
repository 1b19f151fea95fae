package com.annal.version;

import com.annal.query.Filter;
import com.annal.store.Document;
import com.annal.store.DocumentStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Rebuilds a record as it was at an explicit {@code major.minor} version.
 * <p>
 * The entry tagged with the version is located first. From a patch entry the
 * walk goes forward, following whichever entry names the current one as its
 * {@code previous_delta}, until it meets a snapshot or runs out of entries,
 * in which case the live record pointing at the last entry is the base. The
 * collected deltas are then applied exactly as stored, from the base back
 * toward the requested version.
 */
class VersionChainWalker {
    private final DocumentStore store;
    private final RecordType recordType;
    private final String metadataKey;
    private final Logger logger;

    VersionChainWalker(DocumentStore store, RecordType recordType, String metadataKey, Logger logger) {
        this.store = store;
        this.recordType = recordType;
        this.metadataKey = metadataKey;
        this.logger = logger;
    }

    /**
     * @param scope restricts the lookup to one record's entries; {@link Filter#all()} searches the whole type
     */
    Optional<Document> asOfVersion(Filter scope, Version version) {
        DeltaChain chain = new DeltaChain(store, recordType, metadataKey, logger);
        Optional<DeltaEntry> tagged = chain.tagged(scope, version);
        if (tagged.isEmpty()) {
            return liveAtVersion(scope, version);
        }
        DeltaEntry target = tagged.get();
        if (target.isSnapshot()) {
            Map<String, Object> doc = snapshotState(target);
            doc.put(metadataKey, header(target.version(), target.metadata()));
            return Optional.of(new Document(doc));
        }

        List<DeltaEntry> steps = new ArrayList<>();
        steps.add(target);
        DeltaEntry base = null;
        String current = target.id();
        while (true) {
            Optional<DeltaEntry> next = chain.successorOf(current);
            if (next.isEmpty()) {
                break;
            }
            if (next.get().isSnapshot()) {
                base = next.get();
                break;
            }
            steps.add(next.get());
            current = next.get().id();
        }

        Map<String, Object> doc;
        if (base != null) {
            doc = snapshotState(base);
        } else {
            Optional<Document> live = chain.liveRecordPointingAt(current);
            if (live.isEmpty()) {
                logger.warning("No snapshot or live record follows delta " + current + " of "
                        + recordType.name() + "; version " + version + " cannot be rebuilt");
                return Optional.empty();
            }
            doc = live.get().toMutableMap();
            doc.remove(Document.ID_FIELD);
            doc.remove(metadataKey);
        }

        Collections.reverse(steps);
        Map<String, Object> header = null;
        for (DeltaEntry step : steps) {
            step.deltas().applyTo(doc, logger);
            header = header(step.version(), step.metadata());
        }
        doc.put(metadataKey, header);
        return Optional.of(new Document(doc));
    }

    /**
     * A checkpoint snapshot stores the state its write produced together with
     * the reverse delta of that write; applying it yields the state the
     * snapshot is tagged with.
     */
    private Map<String, Object> snapshotState(DeltaEntry snapshot) {
        Map<String, Object> doc = snapshot.workingCopy();
        if (snapshot.deltas() != null) {
            snapshot.deltas().applyTo(doc, logger);
        }
        return doc;
    }

    private Optional<Document> liveAtVersion(Filter scope, Version version) {
        Filter filter = Filter.and(scope,
                Filter.eq(metadataKey + "." + MetadataFields.VERSION + "." + MetadataFields.MAJOR, version.major()),
                Filter.eq(metadataKey + "." + MetadataFields.VERSION + "." + MetadataFields.MINOR, version.minor()));
        Optional<Document> live = store.findOne(recordType.name(), filter);
        if (live.isEmpty()) {
            return Optional.empty();
        }
        MetadataHeader header = MetadataHeader.fromFields(live.get().get(metadataKey));
        Map<String, Object> doc = live.get().toMutableMap();
        doc.remove(Document.ID_FIELD);
        doc.put(metadataKey, header(header.version(), header.versionMetadata()));
        return Optional.of(new Document(doc));
    }

    private static Map<String, Object> header(Version version, Map<String, Object> metadata) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put(MetadataFields.VERSION, version.toFields());
        header.put(MetadataFields.METADATA, metadata);
        return header;
    }
}
