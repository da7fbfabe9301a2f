package net.releasewatch.service;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.dto.FeedItemRecord;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.support.guard.SourceCallGuard;
import net.releasewatch.support.guard.UpstreamFailureClassifier;
import net.releasewatch.util.ExternalApiLogger;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Polls one configured RSS/Atom feed.
 *
 * <p>Each HTTP GET is one guarded call. Retries of transient failures happen in the guard, so
 * every try takes its own slot from the feed's request budget and reports to its breaker.</p>
 */
@Slf4j
public class FeedAdapter {

    private final ReleaseWatchProperties.Feed feed;
    private final WebClient webClient;
    private final RssFeedParser parser;
    private final SourceCallGuard callGuard;

    public FeedAdapter(ReleaseWatchProperties.Feed feed,
                       WebClient webClient,
                       RssFeedParser parser,
                       SourceCallGuard callGuard) {
        this.feed = feed;
        this.webClient = webClient;
        this.parser = parser;
        this.callGuard = callGuard;
    }

    public String feedId() {
        return feed.getId();
    }

    public SourceCallGuard callGuard() {
        return callGuard;
    }

    /**
     * @throws SourceFetchException when the feed could not be fetched
     */
    public List<FeedItemRecord> fetch() {
        ExternalApiLogger.logApiCallAttempt(log, feedId(), "poll", feed.getUrl());
        String body = callGuard.call("poll", this::download);
        List<FeedItemRecord> items = parser.parse(feedId(), body);
        ExternalApiLogger.logApiCallSuccess(log, feedId(), "poll", feed.getUrl(), items.size());
        return items;
    }

    private String download() {
        try {
            return webClient.get()
                .uri(feed.getUrl())
                .accept(MediaType.APPLICATION_XML, MediaType.TEXT_XML, MediaType.valueOf("application/rss+xml"),
                    MediaType.APPLICATION_ATOM_XML, MediaType.ALL)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(feed.getTimeout())
                .block();
        } catch (RuntimeException failure) {
            SourceFetchException classified = UpstreamFailureClassifier.classify(feedId(), failure);
            ExternalApiLogger.logApiCallFailure(log, feedId(), "poll", feed.getUrl(), classified.getMessage());
            throw classified;
        }
    }
}
