package net.releasewatch.service;

import java.util.List;
import net.releasewatch.dto.FeedItemRecord;
import net.releasewatch.exception.SourceFetchException;

/**
 * Result of polling one feed: its items, or the failure that stopped it.
 */
public record FeedOutcome(String feedId, List<FeedItemRecord> items, SourceFetchException failure) {

    public FeedOutcome {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static FeedOutcome success(String feedId, List<FeedItemRecord> items) {
        return new FeedOutcome(feedId, items, null);
    }

    public static FeedOutcome failed(String feedId, SourceFetchException failure) {
        return new FeedOutcome(feedId, List.of(), failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
