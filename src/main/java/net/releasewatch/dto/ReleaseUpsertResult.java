package net.releasewatch.dto;

/**
 * Outcome of a release upsert: the row id and whether this call created it.
 */
public record ReleaseUpsertResult(long releaseId, boolean created) {
}
