package net.releasewatch.service;

import java.util.Map;

/**
 * Summary of one collection cycle, logged at the end of every run.
 *
 * @param fetched           raw records returned by all sources
 * @param filtered          records rejected by the content policy
 * @param skipped           records that could not be normalized
 * @param persistedNew      releases stored for the first time
 * @param persistedExisting releases that were already known
 * @param notified          releases whose primary notification succeeded in this run
 * @param failed            releases whose primary notification gave up in this run
 * @param sourceFailures    failed source id to failure reason
 * @param cancelled         whether the run stopped early on request
 * @param dryRun            whether persistence and notification were skipped
 */
public record CollectionRunReport(
    int fetched,
    int filtered,
    int skipped,
    int persistedNew,
    int persistedExisting,
    int notified,
    int failed,
    Map<String, String> sourceFailures,
    boolean cancelled,
    boolean dryRun
) {

    public CollectionRunReport {
        sourceFailures = sourceFailures == null ? Map.of() : Map.copyOf(sourceFailures);
    }

    public boolean succeeded() {
        return !cancelled && sourceFailures.isEmpty();
    }

    /**
     * 0 on full success, 1 when a source failed or the run was cancelled.
     */
    public int exitCode() {
        return succeeded() ? 0 : 1;
    }
}
