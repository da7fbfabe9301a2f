/**
 * Client for the AniList GraphQL airing schedule.
 * Every page request goes through the source's call guard, so budget, circuit breaker and retry
 * apply per page.
 */
package net.releasewatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.dto.AniListAiringRecord;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.model.SourceState;
import net.releasewatch.support.guard.SourceCallGuard;
import net.releasewatch.support.guard.UpstreamFailureClassifier;
import net.releasewatch.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

@Service
@Slf4j
public class AniListSourceClient {

    static final String API_NAME = "AniList";

    static final String AIRING_SCHEDULE_QUERY = """
        query ($page: Int, $perPage: Int, $from: Int, $to: Int) {
          Page(page: $page, perPage: $perPage) {
            pageInfo { hasNextPage }
            airingSchedules(airingAt_greater: $from, airingAt_lesser: $to, sort: TIME) {
              episode
              airingAt
              media {
                id
                siteUrl
                isAdult
                genres
                description(asHtml: false)
                title { romaji english native }
                tags { name }
                externalLinks { site type }
              }
            }
          }
        }
        """;

    private final WebClient webClient;
    private final ReleaseWatchProperties.AniList settings;
    private final SourceCallGuard callGuard;
    private final Clock clock;

    /**
     * @param webClientBuilder shared WebClient builder
     * @param properties       release-watch configuration
     * @param callGuard        guard holding this source's budget and breaker
     * @param clock            clock used to place the airing window
     */
    public AniListSourceClient(WebClient.Builder webClientBuilder,
                               ReleaseWatchProperties properties,
                               @Qualifier("aniListCallGuard") SourceCallGuard callGuard,
                               Clock clock) {
        this.settings = properties.getAnilist();
        this.webClient = webClientBuilder.clone().baseUrl(settings.getUrl()).build();
        this.callGuard = callGuard;
        this.clock = clock;
    }

    public String sourceId() {
        return callGuard.sourceId();
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    /**
     * Fetches airing schedule entries inside {@code [now - lookback, now + lookahead]}.
     *
     * @throws SourceFetchException when any page fails after the guard gave up
     */
    public List<AniListAiringRecord> fetchAiringSchedule() {
        Instant now = clock.instant();
        long from = now.minus(settings.getLookback()).getEpochSecond();
        long to = now.plus(settings.getLookahead()).getEpochSecond();
        String window = from + ".." + to;

        List<AniListAiringRecord> records = new ArrayList<>();
        int page = 1;
        boolean hasNextPage = true;
        while (hasNextPage && page <= settings.getMaxPages()) {
            int currentPage = page;
            ExternalApiLogger.logApiCallAttempt(log, API_NAME, "airingSchedules page " + currentPage, window);
            JsonNode response;
            try {
                response = callGuard.call("airingSchedules page " + currentPage,
                    () -> fetchPage(currentPage, from, to));
            } catch (SourceFetchException failure) {
                if (failure.getReason() == SourceFetchException.Reason.CIRCUIT_OPEN) {
                    ExternalApiLogger.logCircuitBreakerBlocked(log, API_NAME, window);
                } else {
                    ExternalApiLogger.logApiCallFailure(log, API_NAME, "airingSchedules page " + currentPage,
                        window, failure.getMessage());
                }
                throw failure;
            }
            JsonNode pageNode = response.path("data").path("Page");
            List<AniListAiringRecord> pageRecords = parseSchedules(pageNode.path("airingSchedules"));
            records.addAll(pageRecords);
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, "airingSchedules page " + currentPage,
                window, pageRecords.size());
            hasNextPage = pageNode.path("pageInfo").path("hasNextPage").asBoolean(false);
            page++;
        }
        if (hasNextPage) {
            log.info("AniList still reports more pages after {} page(s); stopping at the configured limit",
                settings.getMaxPages());
        }
        return records;
    }

    public SourceState state() {
        return callGuard.state();
    }

    /**
     * One guarded HTTP round trip. Transport and status failures are classified; a GraphQL
     * {@code errors} array or a response without a page is non-retryable.
     */
    JsonNode fetchPage(int page, long from, long to) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("page", page);
        variables.put("perPage", settings.getPageSize());
        variables.put("from", from);
        variables.put("to", to);
        Map<String, Object> body = Map.of("query", AIRING_SCHEDULE_QUERY, "variables", variables);

        JsonNode response;
        try {
            response = webClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(settings.getTimeout())
                .block();
        } catch (RuntimeException failure) {
            throw UpstreamFailureClassifier.classify(sourceId(), failure);
        }

        if (response == null) {
            throw new SourceFetchException(sourceId(), SourceFetchException.Reason.NON_RETRYABLE, "empty response body");
        }
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            String message = errors.get(0).path("message").asText("unknown GraphQL error");
            throw new SourceFetchException(sourceId(), SourceFetchException.Reason.NON_RETRYABLE, "GraphQL error: " + message);
        }
        if (!response.path("data").path("Page").isObject()) {
            throw new SourceFetchException(sourceId(), SourceFetchException.Reason.NON_RETRYABLE, "response has no data.Page");
        }
        return response;
    }

    List<AniListAiringRecord> parseSchedules(JsonNode schedules) {
        List<AniListAiringRecord> records = new ArrayList<>();
        if (!schedules.isArray()) {
            return records;
        }
        for (JsonNode schedule : schedules) {
            JsonNode media = schedule.path("media");
            if (!media.isObject()) {
                log.debug("Skipping AniList schedule entry without media: {}", schedule);
                continue;
            }
            JsonNode title = media.path("title");
            Integer episode = schedule.hasNonNull("episode") ? schedule.get("episode").asInt() : null;
            Instant airingAt = schedule.hasNonNull("airingAt")
                ? Instant.ofEpochSecond(schedule.get("airingAt").asLong())
                : null;
            records.add(new AniListAiringRecord(
                sourceId(),
                media.path("id").asLong(),
                textOrNull(title, "romaji"),
                textOrNull(title, "english"),
                textOrNull(title, "native"),
                episode,
                airingAt,
                textValues(media.path("genres"), null),
                textValues(media.path("tags"), "name"),
                media.path("isAdult").asBoolean(false),
                textOrNull(media, "siteUrl"),
                textOrNull(media, "description"),
                streamingSites(media.path("externalLinks"))));
        }
        return records;
    }

    private static List<String> streamingSites(JsonNode links) {
        List<String> sites = new ArrayList<>();
        if (!links.isArray()) {
            return sites;
        }
        for (JsonNode link : links) {
            if ("STREAMING".equalsIgnoreCase(link.path("type").asText()) && link.hasNonNull("site")) {
                sites.add(link.get("site").asText());
            }
        }
        return sites;
    }

    private static List<String> textValues(JsonNode array, String field) {
        List<String> values = new ArrayList<>();
        if (!array.isArray()) {
            return values;
        }
        for (JsonNode element : array) {
            JsonNode value = field == null ? element : element.path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                values.add(value.asText());
            }
        }
        return values;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
