package com.annal.version;

/**
 * Counts of documents removed by a hard erase.
 */
public record Erasure(long recordsDeleted, long deltasDeleted) {
}
