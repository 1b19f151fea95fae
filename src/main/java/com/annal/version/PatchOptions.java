package com.annal.version;

import com.annal.store.Documents;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-call options of {@link HistoricalCollection#patchOne}.
 *
 * @param force        append an entry even when nothing changed
 * @param ignoreFields fields left out of the comparison with the stored record
 * @param metadata     caller metadata recorded with the write, may be {@code null}
 */
public record PatchOptions(boolean force, Set<String> ignoreFields, Map<String, Object> metadata) {
    private static final PatchOptions DEFAULTS = new PatchOptions(false, Set.of(), null);

    public PatchOptions {
        ignoreFields = ignoreFields == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ignoreFields));
        metadata = metadata == null ? null : Collections.unmodifiableMap(Documents.deepCopy(metadata));
    }

    public static PatchOptions defaults() {
        return DEFAULTS;
    }

    public PatchOptions withForce(boolean value) {
        return new PatchOptions(value, ignoreFields, metadata);
    }

    public PatchOptions ignoring(String... fields) {
        Set<String> merged = new LinkedHashSet<>(ignoreFields);
        merged.addAll(Arrays.asList(fields));
        return new PatchOptions(force, merged, metadata);
    }

    public PatchOptions withMetadata(Map<String, ?> value) {
        return new PatchOptions(force, ignoreFields, value == null ? null : Documents.deepCopy(value));
    }
}
