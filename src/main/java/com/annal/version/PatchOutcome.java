package com.annal.version;

/**
 * Result of a write that changed a record.
 *
 * @param transition kind of write performed
 * @param recordId   store id of the live record
 * @param deltaId    id of the delta entry the write appended
 * @param version    version of the live record after the write
 */
public record PatchOutcome(Transition transition, String recordId, String deltaId, Version version) {
}
