package com.containermgmt.streamagent.store;

/**
 * Outcome of a committed batch.
 *
 * @param applied events written to the store
 * @param skipped events at or below the stored sequence, or of an unknown kind
 */
public record ApplyResult(int applied, int skipped) {
}
