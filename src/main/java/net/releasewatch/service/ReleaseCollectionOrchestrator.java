package net.releasewatch.service;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.dto.NormalizedRelease;
import net.releasewatch.dto.PersistOutcome;
import net.releasewatch.dto.SourceRecord;
import net.releasewatch.exception.ReleaseNormalizationException;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.repository.ReleaseStore;
import net.releasewatch.util.ExternalApiLogger;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Runs one collection cycle: fetch from every source in parallel, then normalize, filter, persist
 * and dispatch in sequence.
 *
 * <p>A failing source is recorded and the cycle carries on with the others. A release the store
 * rejects is skipped. Configuration failures and unreachable storage end the run by propagating.
 * Cancellation is honoured between stages only.</p>
 */
@Slf4j
@Service
public class ReleaseCollectionOrchestrator {

    private final ReleaseWatchProperties properties;
    private final AniListSourceClient aniListClient;
    private final FeedCollector feedCollector;
    private final ReleaseNormalizer normalizer;
    private final ContentPolicyFilter policyFilter;
    private final ReleaseStore releaseStore;
    private final NotificationDispatcher dispatcher;
    private final CollectionMetrics metrics;
    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);

    public ReleaseCollectionOrchestrator(ReleaseWatchProperties properties,
                                         AniListSourceClient aniListClient,
                                         FeedCollector feedCollector,
                                         ReleaseNormalizer normalizer,
                                         ContentPolicyFilter policyFilter,
                                         ReleaseStore releaseStore,
                                         NotificationDispatcher dispatcher,
                                         CollectionMetrics metrics) {
        this.properties = properties;
        this.aniListClient = aniListClient;
        this.feedCollector = feedCollector;
        this.normalizer = normalizer;
        this.policyFilter = policyFilter;
        this.releaseStore = releaseStore;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    /**
     * Asks the running cycle to stop at the next stage boundary.
     */
    @PreDestroy
    public void requestCancellation() {
        if (cancellationRequested.compareAndSet(false, true)) {
            log.info("Cancellation requested; the current run stops at the next stage boundary");
        }
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    /**
     * @throws net.releasewatch.exception.ReleaseWatchConfigurationException when configuration is unusable
     * @throws org.springframework.dao.DataAccessException when storage is unreachable
     */
    public CollectionRunReport runOnce(boolean dryRun) {
        properties.validateForRun(dryRun);
        if (!dryRun) {
            releaseStore.probe();
        }
        log.info("Collection run started (dryRun={})", dryRun);

        Map<String, String> sourceFailures = new LinkedHashMap<>();
        List<SourceRecord> records = fetchAll(sourceFailures);
        RunCounters counters = new RunCounters();
        counters.fetched = records.size();
        if (cancellationRequested.get()) {
            return finish(counters, sourceFailures, true, dryRun);
        }

        List<NormalizedRelease> kept = normalizeAndFilter(records, counters);
        if (dryRun) {
            for (NormalizedRelease release : kept) {
                log.info("[DRY-RUN] would persist {}", release.dedupKey());
            }
            return finish(counters, sourceFailures, false, dryRun);
        }
        if (cancellationRequested.get()) {
            return finish(counters, sourceFailures, true, dryRun);
        }

        for (NormalizedRelease release : kept) {
            PersistOutcome outcome;
            try {
                outcome = releaseStore.persist(release);
            } catch (DataIntegrityViolationException rejected) {
                counters.skipped++;
                metrics.recordSkipped(release.sourceId());
                log.warn("Store rejected release {} from {}; skipped: {}", release.dedupKey(), release.sourceId(),
                    rejected.getMostSpecificCause().getMessage());
                continue;
            }
            metrics.recordPersisted(outcome.created());
            ExternalApiLogger.logPersistence(log, release.sourceId(), outcome.releaseId(), outcome.created(),
                release.dedupKey());
            if (outcome.created()) {
                counters.persistedNew++;
            } else {
                counters.persistedExisting++;
            }
        }
        log.info("Store now holds {} release(s) across {} work(s)", releaseStore.countReleases(),
            releaseStore.countWorks());
        if (cancellationRequested.get()) {
            return finish(counters, sourceFailures, true, dryRun);
        }

        if (properties.getNotification().isEnabled()) {
            DispatchSummary summary = dispatcher.dispatch(
                releaseStore.listUnnotified(properties.getNotification().getDispatchLimit()));
            summary = summary.plus(dispatcher.retryPendingCalendarEvents());
            counters.notified = summary.sent();
            counters.failed = summary.failed();
        } else {
            log.info("Notifications disabled; {} release(s) left unnotified", kept.size());
        }
        return finish(counters, sourceFailures, false, dryRun);
    }

    private List<SourceRecord> fetchAll(Map<String, String> sourceFailures) {
        Map<String, Callable<List<? extends SourceRecord>>> tasks = new LinkedHashMap<>();
        if (aniListClient.isEnabled()) {
            tasks.put(aniListClient.sourceId(), aniListClient::fetchAiringSchedule);
        }
        for (FeedAdapter adapter : feedCollector.adapters()) {
            tasks.put(adapter.feedId(), () -> {
                FeedOutcome outcome = feedCollector.poll(adapter);
                if (!outcome.succeeded()) {
                    throw outcome.failure();
                }
                return outcome.items();
            });
        }
        for (String skippedFeed : feedCollector.skippedFeedIds()) {
            log.info("Feed {} is disabled; skipped", skippedFeed);
        }
        if (tasks.isEmpty()) {
            log.warn("No enabled sources; nothing to fetch");
            return List.of();
        }

        ExecutorService pool = Executors.newFixedThreadPool(tasks.size(), sourceThreadFactory());
        try {
            Map<String, Future<List<? extends SourceRecord>>> futures = new LinkedHashMap<>();
            tasks.forEach((sourceId, task) -> futures.put(sourceId, pool.submit(task)));

            List<SourceRecord> records = new ArrayList<>();
            for (Map.Entry<String, Future<List<? extends SourceRecord>>> entry : futures.entrySet()) {
                String sourceId = entry.getKey();
                try {
                    List<? extends SourceRecord> sourceRecords = entry.getValue().get();
                    records.addAll(sourceRecords);
                    metrics.recordFetched(sourceId, sourceRecords.size());
                    log.info("Source {} returned {} record(s)", sourceId, sourceRecords.size());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    String reason = cause instanceof SourceFetchException fetchFailure
                        ? fetchFailure.getReason().name()
                        : cause.getClass().getSimpleName();
                    sourceFailures.put(sourceId, reason);
                    metrics.recordSourceFailure(sourceId, reason);
                    log.warn("Source {} failed ({}): {}", sourceId, reason, cause.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    sourceFailures.put(sourceId, "INTERRUPTED");
                    requestCancellation();
                    break;
                }
            }
            return records;
        } finally {
            pool.shutdownNow();
        }
    }

    private List<NormalizedRelease> normalizeAndFilter(List<SourceRecord> records, RunCounters counters) {
        List<NormalizedRelease> kept = new ArrayList<>();
        for (SourceRecord record : records) {
            NormalizedRelease release;
            try {
                release = normalizer.normalize(record);
            } catch (ReleaseNormalizationException e) {
                counters.skipped++;
                metrics.recordSkipped(record.sourceId());
                log.warn("Skipping record {} from {}: {}", record.itemKey(), record.sourceId(), e.getMessage());
                continue;
            }
            FilterDecision decision = policyFilter.evaluate(release);
            if (!decision.kept()) {
                counters.filtered++;
                metrics.recordFiltered(record.sourceId());
                continue;
            }
            kept.add(release);
        }
        return kept;
    }

    private CollectionRunReport finish(RunCounters counters,
                                       Map<String, String> sourceFailures,
                                       boolean cancelled,
                                       boolean dryRun) {
        CollectionRunReport report = new CollectionRunReport(
            counters.fetched,
            counters.filtered,
            counters.skipped,
            counters.persistedNew,
            counters.persistedExisting,
            counters.notified,
            counters.failed,
            sourceFailures,
            cancelled,
            dryRun);
        metrics.recordRun(report.succeeded());
        log.info("Collection run finished: {}", report);
        return report;
    }

    private static ThreadFactory sourceThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "source-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class RunCounters {
        private int fetched;
        private int filtered;
        private int skipped;
        private int persistedNew;
        private int persistedExisting;
        private int notified;
        private int failed;
    }
}
