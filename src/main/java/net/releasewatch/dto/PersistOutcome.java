package net.releasewatch.dto;

/**
 * Outcome of persisting one normalized release, work and release together.
 */
public record PersistOutcome(long workId, long releaseId, boolean created) {
}
