package com.annal.version;

import java.util.List;

/**
 * @param outcomes      one entry per record that actually changed, in input order
 * @param markedDeleted number of live records newly marked deleted
 */
public record BulkPatchResult(List<PatchOutcome> outcomes, long markedDeleted) {
    public BulkPatchResult {
        outcomes = List.copyOf(outcomes);
    }
}
