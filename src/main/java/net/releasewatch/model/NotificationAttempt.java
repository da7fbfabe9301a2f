package net.releasewatch.model;

import java.time.Instant;

/**
 * Append-only record of one channel attempt sequence.
 *
 * @param id           surrogate id, {@code null} before insert
 * @param attemptedAt  when the sequence finished
 * @param channel      channel that was attempted
 * @param success      whether the channel accepted the notification
 * @param errorDetail  last error message for failed sequences
 * @param itemCount    number of releases covered by the attempt
 * @param releaseId    release the attempt concerned, if any
 * @param attempts     tries used before success or exhaustion
 */
public record NotificationAttempt(
    Long id,
    Instant attemptedAt,
    NotificationChannel channel,
    boolean success,
    String errorDetail,
    int itemCount,
    Long releaseId,
    int attempts
) {

    public static NotificationAttempt succeeded(Instant at, NotificationChannel channel, long releaseId, int attempts) {
        return new NotificationAttempt(null, at, channel, true, null, 1, releaseId, attempts);
    }

    public static NotificationAttempt failed(Instant at,
                                             NotificationChannel channel,
                                             long releaseId,
                                             int attempts,
                                             String errorDetail) {
        return new NotificationAttempt(null, at, channel, false, errorDetail, 1, releaseId, attempts);
    }
}
