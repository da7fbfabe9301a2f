package net.releasewatch.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.support.guard.SourceCallGuard;
import net.releasewatch.support.retry.Sleeper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Owns one {@link FeedAdapter} per enabled feed and isolates their failures.
 */
@Slf4j
@Service
public class FeedCollector {

    private final List<FeedAdapter> adapters;
    private final List<String> skippedFeedIds;
    private final Map<String, FeedHealth> health = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public FeedCollector(WebClient.Builder webClientBuilder,
                         ReleaseWatchProperties properties,
                         Clock clock,
                         Sleeper sleeper) {
        this(buildAdapters(webClientBuilder, properties, clock, sleeper), skipped(properties), clock);
    }

    FeedCollector(List<FeedAdapter> adapters, List<String> skippedFeedIds, Clock clock) {
        this.adapters = List.copyOf(adapters);
        this.skippedFeedIds = List.copyOf(skippedFeedIds);
        this.clock = clock;
        for (FeedAdapter adapter : this.adapters) {
            health.put(adapter.feedId(), FeedHealth.initial(adapter.feedId()));
        }
    }

    public List<FeedAdapter> adapters() {
        return adapters;
    }

    /** Configured feeds that are disabled and therefore not polled. */
    public List<String> skippedFeedIds() {
        return skippedFeedIds;
    }

    /**
     * Polls one feed. Never throws for fetch failures; they come back inside the outcome.
     */
    public FeedOutcome poll(FeedAdapter adapter) {
        try {
            FeedOutcome outcome = FeedOutcome.success(adapter.feedId(), adapter.fetch());
            health.compute(adapter.feedId(), (id, current) ->
                (current != null ? current : FeedHealth.initial(id)).withSuccess(clock.instant()));
            return outcome;
        } catch (SourceFetchException failure) {
            FeedHealth updated = health.compute(adapter.feedId(), (id, current) ->
                (current != null ? current : FeedHealth.initial(id)).withFailure(clock.instant(), failure.getMessage()));
            log.warn("Feed {} failed ({} consecutive): {}", adapter.feedId(), updated.consecutiveFailures(),
                failure.getMessage());
            return FeedOutcome.failed(adapter.feedId(), failure);
        }
    }

    public List<FeedOutcome> pollAll() {
        List<FeedOutcome> outcomes = new ArrayList<>();
        for (FeedAdapter adapter : adapters) {
            outcomes.add(poll(adapter));
        }
        return outcomes;
    }

    public Map<String, FeedHealth> health() {
        return Map.copyOf(health);
    }

    private static List<FeedAdapter> buildAdapters(WebClient.Builder webClientBuilder,
                                                   ReleaseWatchProperties properties,
                                                   Clock clock,
                                                   Sleeper sleeper) {
        WebClient webClient = webClientBuilder.clone().build();
        RssFeedParser parser = new RssFeedParser(properties.getZone());
        List<FeedAdapter> adapters = new ArrayList<>();
        for (ReleaseWatchProperties.Feed feed : properties.enabledFeeds()) {
            adapters.add(new FeedAdapter(feed, webClient, parser, guardFor(feed, properties, clock, sleeper)));
            log.info("Feed {} registered ({}, {})", feed.getId(), feed.getKind(), feed.getUrl());
        }
        return adapters;
    }

    /**
     * One guarded call per HTTP try: the first try plus {@code retry-count} retries.
     */
    static SourceCallGuard guardFor(ReleaseWatchProperties.Feed feed,
                                    ReleaseWatchProperties properties,
                                    Clock clock,
                                    Sleeper sleeper) {
        return SourceCallGuard.create(feed.getId(), properties, Math.max(0, feed.getRetryCount()) + 1,
            feed.getRetryBackoff(), clock, sleeper);
    }

    private static List<String> skipped(ReleaseWatchProperties properties) {
        return properties.getFeeds().stream()
            .filter(feed -> !feed.isEnabled())
            .map(ReleaseWatchProperties.Feed::getId)
            .toList();
    }
}
