package net.releasewatch.dto;

import java.time.Instant;
import java.util.List;

/**
 * One {@code <item>} or {@code <entry>} parsed from an RSS or Atom feed.
 */
public record FeedItemRecord(
    String sourceId,
    String title,
    String link,
    String description,
    Instant publishedAt,
    String guid,
    List<String> categories
) implements SourceRecord {

    public FeedItemRecord {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    @Override
    public String itemKey() {
        if (guid != null && !guid.isBlank()) {
            return guid;
        }
        return link != null ? link : String.valueOf(title);
    }
}
