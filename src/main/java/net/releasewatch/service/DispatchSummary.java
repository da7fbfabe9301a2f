package net.releasewatch.service;

/**
 * Counts from one dispatch pass.
 *
 * @param sent            releases whose primary notification succeeded and were marked notified
 * @param failed          releases whose primary channel gave up; they stay unnotified
 * @param skipped         releases that were already notified
 * @param calendarCreated calendar events created or found for a release
 * @param calendarFailed  calendar sequences that gave up
 */
public record DispatchSummary(int sent, int failed, int skipped, int calendarCreated, int calendarFailed) {

    public static DispatchSummary empty() {
        return new DispatchSummary(0, 0, 0, 0, 0);
    }

    public DispatchSummary plus(DispatchSummary other) {
        return new DispatchSummary(
            sent + other.sent,
            failed + other.failed,
            skipped + other.skipped,
            calendarCreated + other.calendarCreated,
            calendarFailed + other.calendarFailed);
    }
}
