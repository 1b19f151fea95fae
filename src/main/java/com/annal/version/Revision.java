package com.annal.version;

import java.time.Instant;
import java.util.Map;

/**
 * One step of a record's history as listed by {@link HistoricalCollection#revisions}.
 *
 * @param id         id of the live record or the delta entry
 * @param kind       where the revision lives
 * @param version    version tag
 * @param recordedAt time of the write that stored this step
 * @param metadata   caller metadata of the version
 */
public record Revision(String id, Kind kind, Version version, Instant recordedAt, Map<String, Object> metadata) {

    public enum Kind {
        LIVE,
        SNAPSHOT,
        PATCH
    }
}
