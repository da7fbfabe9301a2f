package net.releasewatch.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import net.releasewatch.exception.ReleaseWatchConfigurationException;
import net.releasewatch.model.WorkKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Strongly typed configuration for the collection cycle, bound once at startup and injected
 * into every component that needs it.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "release-watch")
public class ReleaseWatchProperties {

    public static final String ANILIST_SOURCE_ID = "anilist";

    /**
     * Requests-per-minute budget per source id.
     */
    private Map<String, Integer> sourceBudgets = new LinkedHashMap<>(Map.of(ANILIST_SOURCE_ID, 90));

    private RateLimit rateLimit = new RateLimit();

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    private SourceRetry sourceRetry = new SourceRetry();

    private AniList anilist = new AniList();

    /**
     * Terms rejected when found (case-insensitively) in titles, descriptions or tags.
     */
    private List<String> denylist = new ArrayList<>();

    /**
     * Genres rejected as whole tag values.
     */
    private List<String> deniedGenres = new ArrayList<>();

    /**
     * Tags rejected as whole tag values.
     */
    private List<String> excludedTags = new ArrayList<>();

    /**
     * Whether records flagged adult by their source are rejected.
     */
    private boolean excludeAdult = true;

    /**
     * Zone used to turn source instants into release dates.
     */
    private ZoneId zone = ZoneId.of("Asia/Tokyo");

    private Notification notification = new Notification();

    private List<Feed> feeds = new ArrayList<>();

    static final int DEFAULT_BUDGET = 60;

    /**
     * Budget for a source, or {@value #DEFAULT_BUDGET} requests per minute when none is configured.
     */
    public int budgetFor(String sourceId) {
        Integer budget = sourceBudgets.get(sourceId);
        return budget != null ? budget : DEFAULT_BUDGET;
    }

    public List<Feed> enabledFeeds() {
        return feeds.stream().filter(Feed::isEnabled).toList();
    }

    /**
     * Checks everything a run needs before it touches the network.
     *
     * @param dryRun dry runs never notify, so channel credentials are not required
     * @throws ReleaseWatchConfigurationException listing every problem found
     */
    public void validateForRun(boolean dryRun) {
        List<String> problems = new ArrayList<>();

        sourceBudgets.forEach((sourceId, budget) -> {
            if (budget == null || budget < 1) {
                problems.add("source-budgets." + sourceId + " must be at least 1");
            }
        });
        if (circuitBreaker.getFailureThreshold() < 1) {
            problems.add("circuit-breaker.failure-threshold must be at least 1");
        }
        if (circuitBreaker.getCooldown() == null || circuitBreaker.getCooldown().isNegative()) {
            problems.add("circuit-breaker.cooldown must be non-negative");
        }
        if (sourceRetry.getMaxAttempts() < 1) {
            problems.add("source-retry.max-attempts must be at least 1");
        }
        if (rateLimit.getBurstThreshold() <= 0 || rateLimit.getBurstThreshold() > 1) {
            problems.add("rate-limit.burst-threshold must be in (0, 1]");
        }
        if (anilist.isEnabled() && !StringUtils.hasText(anilist.getUrl())) {
            problems.add("anilist.url is required when AniList collection is enabled");
        }

        Set<String> feedIds = new HashSet<>();
        for (Feed feed : feeds) {
            if (!StringUtils.hasText(feed.getId())) {
                problems.add("feeds[].id is required");
                continue;
            }
            if (!feedIds.add(feed.getId())) {
                problems.add("feeds id '" + feed.getId() + "' is duplicated");
            }
            if (ANILIST_SOURCE_ID.equals(feed.getId())) {
                problems.add("feeds id '" + ANILIST_SOURCE_ID + "' is reserved");
            }
            if (feed.isEnabled() && !StringUtils.hasText(feed.getUrl())) {
                problems.add("feeds." + feed.getId() + ".url is required for enabled feeds");
            }
            if (feed.getKind() == null) {
                problems.add("feeds." + feed.getId() + ".kind is required");
            }
        }

        if (!dryRun && notification.isEnabled()) {
            if (!StringUtils.hasText(notification.getRecipient())) {
                problems.add("notification.recipient is required when notifications are enabled");
            }
            if (notification.getRetryCount() < 1) {
                problems.add("notification.retry-count must be at least 1");
            }
            Notification.Calendar calendar = notification.getCalendar();
            if (calendar.isEnabled()) {
                if (!StringUtils.hasText(calendar.getCalendarId())) {
                    problems.add("notification.calendar.calendar-id is required when the calendar channel is enabled");
                }
                if (!StringUtils.hasText(calendar.getAccessToken())) {
                    problems.add("notification.calendar.access-token is required when the calendar channel is enabled");
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new ReleaseWatchConfigurationException(problems);
        }
    }

    @Getter
    @Setter
    public static class RateLimit {
        /** Consumed/available ratio above which the rate is throttled. */
        private double burstThreshold = 0.7;
        private double throttleFactor = 0.8;
        private double recoveryFactor = 1.05;
        /** Consecutive successes that make up one stable window. */
        private int stableWindowSuccesses = 10;
        private int minRequestsPerMinute = 1;
        /** Longest a caller may wait for budget before failing with RATE_LIMITED. */
        private Duration maxWait = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class SourceRetry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class AniList {
        private boolean enabled = true;
        private String url = "https://graphql.anilist.co";
        private Duration timeout = Duration.ofSeconds(30);
        /** How far back from now the airing schedule window starts. */
        private Duration lookback = Duration.ofDays(1);
        /** How far ahead of now the airing schedule window ends. */
        private Duration lookahead = Duration.ofDays(7);
        private int pageSize = 50;
        private int maxPages = 5;
    }

    @Getter
    @Setter
    public static class Notification {
        private boolean enabled = true;
        private String recipient;
        private String sender;
        private String subjectPrefix = "[Release Watch]";
        /** Attempts per channel, first try included. */
        private int retryCount = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(30);
        /** Maximum unnotified releases dispatched per run. */
        private int dispatchLimit = 100;
        /** Daily time the external scheduler triggers a run; used for "next scheduled" queries. */
        private int scheduleHour = 8;
        private int scheduleMinute = 0;
        private Calendar calendar = new Calendar();

        @Getter
        @Setter
        public static class Calendar {
            private boolean enabled = false;
            private String calendarId;
            private String baseUrl = "https://www.googleapis.com/calendar/v3";
            private String accessToken;
            private Duration timeout = Duration.ofSeconds(20);
            private LocalTime startTime = LocalTime.of(9, 0);
            private Duration duration = Duration.ofMinutes(60);
            private List<Integer> reminderMinutes = new ArrayList<>(List.of(60, 10));
            /** Notified releases older than this are no longer retried on the calendar channel. */
            private Duration retryWindow = Duration.ofDays(14);
        }
    }

    @Getter
    @Setter
    public static class Feed {
        private String id;
        private String url;
        private WorkKind kind = WorkKind.MANGA;
        /** Distribution platform label; the feed id is used when blank. */
        private String platform;
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(15);
        private int retryCount = 2;
        private Duration retryBackoff = Duration.ofSeconds(1);

        public String platformLabel() {
            return StringUtils.hasText(platform) ? platform : id;
        }
    }
}
