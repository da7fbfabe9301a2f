package net.releasewatch.dto;

import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import net.releasewatch.model.ReleaseKind;
import net.releasewatch.model.WorkKind;

/**
 * Canonical release shape shared by every source after normalization.
 *
 * <p>{@code rawTitle} is the source title before the release marker was cut off; it defaults to
 * {@code title} and is only used for content filtering.</p>
 */
@Builder(toBuilder = true)
public record NormalizedRelease(
    String title,
    String titleEn,
    String titleAlt,
    WorkKind workKind,
    ReleaseKind releaseKind,
    String number,
    String platform,
    LocalDate releaseDate,
    String sourceId,
    String sourceUrl,
    String officialUrl,
    String description,
    List<String> tags,
    boolean adult,
    String rawTitle
) {

    public NormalizedRelease {
        rawTitle = rawTitle == null ? title : rawTitle;
        number = number == null ? "" : number;
        platform = platform == null ? "" : platform;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /** Dedup key rendered for logs; mirrors the unique constraint on releases. */
    public String dedupKey() {
        return title + "|" + workKind + "|" + releaseKind + "|" + number + "|" + platform + "|" + releaseDate;
    }
}
