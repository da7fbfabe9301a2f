package net.releasewatch.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.dto.AniListAiringRecord;
import net.releasewatch.dto.FeedItemRecord;
import net.releasewatch.dto.NormalizedRelease;
import net.releasewatch.dto.SourceRecord;
import net.releasewatch.exception.ReleaseNormalizationException;
import net.releasewatch.model.ReleaseKind;
import net.releasewatch.model.WorkKind;
import net.releasewatch.util.DateParsingUtils;
import net.releasewatch.util.ReleaseTitleParser;
import net.releasewatch.util.TextUtils;
import org.springframework.stereotype.Service;

/**
 * Maps raw source records onto {@link NormalizedRelease}. Stateless apart from configuration.
 *
 * <p>Stored text is cut to the column widths of {@code schema.sql}; URLs too long to store are
 * dropped rather than cut.</p>
 */
@Service
public class ReleaseNormalizer {

    static final String DEFAULT_ANIME_PLATFORM = "TV";
    static final int MAX_TITLE_LENGTH = 512;
    static final int MAX_NUMBER_LENGTH = 64;
    static final int MAX_PLATFORM_LENGTH = 128;
    static final int MAX_URL_LENGTH = 1024;

    private final ZoneId zone;
    private final Clock clock;
    private final Map<String, ReleaseWatchProperties.Feed> feedsById;

    public ReleaseNormalizer(ReleaseWatchProperties properties, Clock clock) {
        this.zone = properties.getZone();
        this.clock = clock;
        this.feedsById = properties.getFeeds().stream()
            .filter(feed -> TextUtils.hasText(feed.getId()))
            .collect(Collectors.toMap(ReleaseWatchProperties.Feed::getId, Function.identity(), (first, second) -> first));
    }

    /**
     * @throws ReleaseNormalizationException when the record has no usable title or comes from an
     *                                       unknown feed
     */
    public NormalizedRelease normalize(SourceRecord record) {
        if (record instanceof AniListAiringRecord airing) {
            return normalizeAiring(airing);
        }
        if (record instanceof FeedItemRecord item) {
            return normalizeFeedItem(item);
        }
        throw new ReleaseNormalizationException(record.itemKey(), "Unsupported record type " + record.getClass().getSimpleName());
    }

    private NormalizedRelease normalizeAiring(AniListAiringRecord airing) {
        String title = TextUtils.firstNonBlank(airing.titleRomaji(), airing.titleEnglish(), airing.titleNative());
        if (title == null) {
            throw new ReleaseNormalizationException(airing.itemKey(), "AniList record has no title");
        }
        List<String> tags = new ArrayList<>(airing.genres());
        tags.addAll(airing.tags());
        String platform = airing.streamingSites().stream()
            .filter(TextUtils::hasText)
            .findFirst()
            .orElse(DEFAULT_ANIME_PLATFORM);
        LocalDate releaseDate = airing.airingAt() != null
            ? DateParsingUtils.toLocalDate(airing.airingAt(), zone)
            : LocalDate.now(clock.withZone(zone));

        return NormalizedRelease.builder()
            .title(fit(TextUtils.collapseWhitespace(title), MAX_TITLE_LENGTH))
            .titleEn(fit(blankToNull(airing.titleEnglish()), MAX_TITLE_LENGTH))
            .titleAlt(fit(blankToNull(airing.titleNative()), MAX_TITLE_LENGTH))
            .workKind(WorkKind.ANIME)
            .releaseKind(ReleaseKind.EPISODE)
            .number(airing.episode() != null ? String.valueOf(airing.episode()) : "")
            .platform(fit(platform.strip(), MAX_PLATFORM_LENGTH))
            .releaseDate(releaseDate)
            .sourceId(airing.sourceId())
            .sourceUrl(storableUrl(airing.siteUrl()))
            .officialUrl(storableUrl(airing.siteUrl()))
            .description(TextUtils.stripMarkup(airing.description()))
            .tags(tags)
            .adult(airing.adult())
            .build();
    }

    private NormalizedRelease normalizeFeedItem(FeedItemRecord item) {
        ReleaseWatchProperties.Feed feed = feedsById.get(item.sourceId());
        if (feed == null) {
            throw new ReleaseNormalizationException(item.itemKey(), "No feed configured with id " + item.sourceId());
        }
        String rawTitle = TextUtils.stripMarkup(item.title());
        if (rawTitle.isEmpty()) {
            throw new ReleaseNormalizationException(item.itemKey(), "Feed item has no title");
        }
        ReleaseTitleParser.ParsedTitle parsed = ReleaseTitleParser.parse(rawTitle, feed.getKind());
        LocalDate releaseDate = item.publishedAt() != null
            ? DateParsingUtils.toLocalDate(item.publishedAt(), zone)
            : LocalDate.now(clock.withZone(zone));

        return NormalizedRelease.builder()
            .title(fit(parsed.workTitle(), MAX_TITLE_LENGTH))
            .rawTitle(rawTitle)
            .workKind(feed.getKind())
            .releaseKind(parsed.releaseKind())
            .number(fit(parsed.number(), MAX_NUMBER_LENGTH))
            .platform(fit(feed.platformLabel(), MAX_PLATFORM_LENGTH))
            .releaseDate(releaseDate)
            .sourceId(item.sourceId())
            .sourceUrl(storableUrl(item.link()))
            .description(TextUtils.stripMarkup(item.description()))
            .tags(item.categories())
            .adult(false)
            .build();
    }

    private static String fit(String value, int maxLength) {
        return value == null ? null : TextUtils.truncate(value, maxLength);
    }

    private static String storableUrl(String url) {
        return url != null && url.length() <= MAX_URL_LENGTH ? url : null;
    }

    private static String blankToNull(String value) {
        return TextUtils.hasText(value) ? TextUtils.collapseWhitespace(value) : null;
    }
}
