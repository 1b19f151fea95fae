package com.annal.version;

import com.annal.query.Filter;
import com.annal.store.Documents;

import java.util.Collections;
import java.util.Map;

/**
 * Options of {@link HistoricalCollection#patchMany}.
 *
 * @param missingMarkDeleted        mark live records absent from the batch as deleted
 * @param missingMarkDeletedFilter  restricts which absent records get marked
 * @param metadata                  caller metadata for every write and deletion mark
 */
public record BulkPatchOptions(boolean missingMarkDeleted, Filter missingMarkDeletedFilter, Map<String, Object> metadata) {
    private static final BulkPatchOptions DEFAULTS = new BulkPatchOptions(false, Filter.all(), null);

    public BulkPatchOptions {
        missingMarkDeletedFilter = missingMarkDeletedFilter == null ? Filter.all() : missingMarkDeletedFilter;
        metadata = metadata == null ? null : Collections.unmodifiableMap(Documents.deepCopy(metadata));
    }

    public static BulkPatchOptions defaults() {
        return DEFAULTS;
    }

    /** Marks every live record missing from the batch. */
    public static BulkPatchOptions markingMissingDeleted() {
        return new BulkPatchOptions(true, Filter.all(), null);
    }

    /** Marks live records missing from the batch that also match the filter. */
    public static BulkPatchOptions markingMissingDeleted(Filter filter) {
        return new BulkPatchOptions(true, filter, null);
    }

    public BulkPatchOptions withMetadata(Map<String, ?> value) {
        return new BulkPatchOptions(missingMarkDeleted, missingMarkDeletedFilter,
                value == null ? null : Documents.deepCopy(value));
    }
}
