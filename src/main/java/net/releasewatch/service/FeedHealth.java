package net.releasewatch.service;

import java.time.Instant;

/**
 * In-memory health of one feed across the polls of this process.
 */
public record FeedHealth(
    String feedId,
    int consecutiveFailures,
    Instant lastSuccessAt,
    Instant lastFailureAt,
    String lastError
) {

    static FeedHealth initial(String feedId) {
        return new FeedHealth(feedId, 0, null, null, null);
    }

    FeedHealth withSuccess(Instant at) {
        return new FeedHealth(feedId, 0, at, lastFailureAt, lastError);
    }

    FeedHealth withFailure(Instant at, String error) {
        return new FeedHealth(feedId, consecutiveFailures + 1, lastSuccessAt, at, error);
    }

    public boolean healthy() {
        return consecutiveFailures == 0;
    }
}
