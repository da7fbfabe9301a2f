package net.releasewatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.dto.FeedItemRecord;
import net.releasewatch.dto.NormalizedRelease;
import net.releasewatch.model.WorkKind;
import net.releasewatch.testutil.MutableClock;
import net.releasewatch.testutil.ReleaseFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContentPolicyFilterTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 10);

    private ReleaseWatchProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ReleaseWatchProperties();
        properties.setDenylist(List.of("R18"));
        properties.setDeniedGenres(List.of("Hentai"));
        properties.setExcludedTags(List.of("Gore"));
    }

    @Test
    @DisplayName("A denylisted term in the title rejects the release regardless of case")
    void should_RejectRelease_When_TitleContainsDenylistedTerm() {
        ContentPolicyFilter filter = new ContentPolicyFilter(properties);
        NormalizedRelease release = ReleaseFixtures.anime("Work r18 Special", "", DATE).build();

        FilterDecision decision = filter.evaluate(release);

        assertThat(decision.kept()).isFalse();
        assertThat(decision.matchedTerm()).isEqualTo("r18");
        assertThat(decision.field()).isEqualTo("title");
    }

    @Test
    void should_RejectRelease_When_AlternateTitleOrTagContainsTerm() {
        ContentPolicyFilter filter = new ContentPolicyFilter(properties);

        assertThat(filter.isAllowed(ReleaseFixtures.anime("Safe", "1", DATE).titleAlt("作品R18版").build())).isFalse();
        assertThat(filter.evaluate(ReleaseFixtures.anime("Safe", "1", DATE).tags(List.of("Romance", "R18+")).build()).field())
            .isEqualTo("tags");
    }

    @Test
    void should_RejectFeedRelease_When_TermIsPartOfReleaseMarker() {
        properties.setDenylist(List.of("OVA"));
        properties.getFeeds().add(ReleaseFixtures.feed("shonen-news", WorkKind.ANIME, null));
        ReleaseNormalizer normalizer = new ReleaseNormalizer(properties,
            new MutableClock(Instant.parse("2025-01-10T00:00:00Z")));
        NormalizedRelease release = normalizer.normalize(new FeedItemRecord("shonen-news", "Some Show OVA",
            "https://news.example/some-show-ova", null, null, "sn-ova", null));

        FilterDecision decision = new ContentPolicyFilter(properties).evaluate(release);

        assertThat(release.title()).isEqualTo("Some Show");
        assertThat(decision.kept()).isFalse();
        assertThat(decision.matchedTerm()).isEqualTo("ova");
        assertThat(decision.field()).isEqualTo("rawTitle");
    }

    @Test
    void should_OnlyScanDescriptionPrefix_When_DescriptionIsLong() {
        ContentPolicyFilter filter = new ContentPolicyFilter(properties);
        String padding = "a".repeat(ContentPolicyFilter.DESCRIPTION_SCAN_LENGTH);

        assertThat(filter.isAllowed(ReleaseFixtures.anime("Safe", "1", DATE).description(padding + " R18").build())).isTrue();
        assertThat(filter.isAllowed(ReleaseFixtures.anime("Safe", "1", DATE).description("Rated R18 edition").build())).isFalse();
    }

    @Test
    void should_MatchGenresAndTagsAsWholeValues_When_Configured() {
        ContentPolicyFilter filter = new ContentPolicyFilter(properties);

        FilterDecision genre = filter.evaluate(ReleaseFixtures.anime("Safe", "1", DATE).tags(List.of("hentai")).build());
        FilterDecision tag = filter.evaluate(ReleaseFixtures.anime("Safe", "1", DATE).tags(List.of(" Gore ")).build());

        assertThat(genre.kept()).isFalse();
        assertThat(tag.kept()).isFalse();
        assertThat(filter.isAllowed(ReleaseFixtures.anime("Safe", "1", DATE).tags(List.of("Gorey Comedy")).build())).isTrue();
    }

    @Test
    void should_RejectAdultRecords_Only_When_ExclusionEnabled() {
        NormalizedRelease adult = ReleaseFixtures.anime("Safe", "1", DATE).adult(true).build();

        assertThat(new ContentPolicyFilter(properties).evaluate(adult).field()).isEqualTo("adult");

        properties.setExcludeAdult(false);
        assertThat(new ContentPolicyFilter(properties).isAllowed(adult)).isTrue();
    }

    @Test
    void should_KeepEverything_When_PolicyEmpty() {
        ContentPolicyFilter filter = new ContentPolicyFilter(new ReleaseWatchProperties());

        assertThat(filter.evaluate(ReleaseFixtures.manga("Work R18", "3", DATE).build()))
            .isEqualTo(FilterDecision.keep());
    }
}
