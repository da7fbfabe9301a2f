package net.releasewatch.dto;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the AniList airing schedule.
 */
public record AniListAiringRecord(
    String sourceId,
    long mediaId,
    String titleRomaji,
    String titleEnglish,
    String titleNative,
    Integer episode,
    Instant airingAt,
    List<String> genres,
    List<String> tags,
    boolean adult,
    String siteUrl,
    String description,
    List<String> streamingSites
) implements SourceRecord {

    public AniListAiringRecord {
        genres = genres == null ? List.of() : List.copyOf(genres);
        tags = tags == null ? List.of() : List.copyOf(tags);
        streamingSites = streamingSites == null ? List.of() : List.copyOf(streamingSites);
    }

    @Override
    public String itemKey() {
        return "media:" + mediaId + "/episode:" + episode;
    }
}
