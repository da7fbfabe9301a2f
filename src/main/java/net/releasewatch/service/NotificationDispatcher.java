package net.releasewatch.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.exception.ChannelDeliveryException;
import net.releasewatch.model.NotificationAttempt;
import net.releasewatch.model.NotificationChannel;
import net.releasewatch.model.StoredRelease;
import net.releasewatch.repository.ReleaseStore;
import net.releasewatch.support.retry.BoundedRetrySupport;
import net.releasewatch.support.retry.BoundedRetrySupport.RetryConfig;
import net.releasewatch.support.retry.RetryOutcome;
import net.releasewatch.support.retry.Sleeper;
import net.releasewatch.util.ExternalApiLogger;
import org.springframework.stereotype.Service;

/**
 * Sends at most one notification sequence per release.
 *
 * <p>Mail is the primary channel and alone decides the notified transition. The calendar channel
 * runs independently with its own retries and only contributes the event reference. Every channel
 * sequence leaves one row in the notification history.</p>
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final ReleaseStore releaseStore;
    private final NotificationHistoryService historyService;
    private final ReleaseMailSender mailSender;
    private final CalendarEventGateway calendarGateway;
    private final NotificationRenderer renderer;
    private final CollectionMetrics metrics;
    private final ReleaseWatchProperties properties;
    private final RetryConfig retryConfig;
    private final Clock clock;

    public NotificationDispatcher(ReleaseStore releaseStore,
                                  NotificationHistoryService historyService,
                                  ReleaseMailSender mailSender,
                                  CalendarEventGateway calendarGateway,
                                  NotificationRenderer renderer,
                                  CollectionMetrics metrics,
                                  ReleaseWatchProperties properties,
                                  Clock clock,
                                  Sleeper sleeper) {
        this.releaseStore = releaseStore;
        this.historyService = historyService;
        this.mailSender = mailSender;
        this.calendarGateway = calendarGateway;
        this.renderer = renderer;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        ReleaseWatchProperties.Notification notification = properties.getNotification();
        this.retryConfig = new RetryConfig(
            log,
            Math.max(1, notification.getRetryCount()),
            notification.getInitialBackoff(),
            notification.getMaxBackoff(),
            sleeper);
    }

    /**
     * Dispatches the releases in the order given.
     */
    public DispatchSummary dispatch(List<StoredRelease> releases) {
        int sent = 0;
        int failed = 0;
        int skipped = 0;
        int calendarCreated = 0;
        int calendarFailed = 0;

        for (StoredRelease release : releases) {
            if (release.notified() || alreadyNotified(release.id())) {
                log.debug("Release {} already notified; skipping", release.id());
                skipped++;
                continue;
            }

            boolean mailDelivered = sendMail(release);

            String eventRef = null;
            if (calendarEnabled()) {
                Optional<String> calendarResult = ensureCalendarEvent(release);
                if (calendarResult.isPresent()) {
                    eventRef = calendarResult.get();
                    calendarCreated++;
                } else {
                    calendarFailed++;
                }
            }

            if (mailDelivered) {
                if (releaseStore.markNotified(release.id(), eventRef)) {
                    sent++;
                } else {
                    log.warn("Release {} was marked notified concurrently", release.id());
                    skipped++;
                }
            } else {
                failed++;
                if (eventRef != null) {
                    releaseStore.attachEventRef(release.id(), eventRef);
                }
            }
        }

        DispatchSummary summary = new DispatchSummary(sent, failed, skipped, calendarCreated, calendarFailed);
        log.info("Dispatch finished: {}", summary);
        return summary;
    }

    /**
     * Retries the calendar channel for notified releases that never got an event, within the
     * configured retry window.
     */
    public DispatchSummary retryPendingCalendarEvents() {
        if (!calendarEnabled()) {
            return DispatchSummary.empty();
        }
        ReleaseWatchProperties.Notification.Calendar calendar = properties.getNotification().getCalendar();
        LocalDate since = LocalDate.now(clock.withZone(properties.getZone()))
            .minusDays(calendar.getRetryWindow().toDays());
        List<StoredRelease> pending = releaseStore.listAwaitingCalendarEvent(since, properties.getNotification().getDispatchLimit());
        int created = 0;
        int failedCount = 0;
        for (StoredRelease release : pending) {
            Optional<String> eventRef = ensureCalendarEvent(release);
            if (eventRef.isPresent()) {
                releaseStore.attachEventRef(release.id(), eventRef.get());
                created++;
            } else {
                failedCount++;
            }
        }
        if (!pending.isEmpty()) {
            log.info("Calendar retry pass: {} pending, {} created, {} failed", pending.size(), created, failedCount);
        }
        return new DispatchSummary(0, 0, 0, created, failedCount);
    }

    private boolean sendMail(StoredRelease release) {
        String recipient = properties.getNotification().getRecipient();
        RetryOutcome<Boolean> outcome = runChannel(NotificationChannel.EMAIL, release, () -> {
            mailSender.send(recipient, renderer.subject(release), renderer.body(release));
            return Boolean.TRUE;
        });
        return outcome.succeeded();
    }

    private Optional<String> ensureCalendarEvent(StoredRelease release) {
        String calendarId = properties.getNotification().getCalendar().getCalendarId();
        RetryOutcome<String> outcome = runChannel(NotificationChannel.CALENDAR, release, () -> {
            String dedupKey = renderer.dedupKey(release);
            return calendarGateway.findEventByKey(calendarId, dedupKey)
                .orElseGet(() -> calendarGateway.createEvent(renderer.calendarEvent(release)));
        });
        return outcome.succeeded() ? Optional.ofNullable(outcome.value()) : Optional.empty();
    }

    private <T> RetryOutcome<T> runChannel(NotificationChannel channel, StoredRelease release, Supplier<T> delivery) {
        RetryOutcome<T> outcome = BoundedRetrySupport.execute(
            retryConfig,
            channel + " delivery for release " + release.id(),
            NotificationDispatcher::isRetryable,
            delivery);
        NotificationAttempt attempt = outcome.succeeded()
            ? NotificationAttempt.succeeded(clock.instant(), channel, release.id(), outcome.attempts())
            : NotificationAttempt.failed(clock.instant(), channel, release.id(), outcome.attempts(),
                outcome.failureMessage().orElse("unknown error"));
        historyService.record(attempt);
        metrics.recordDelivery(channel, outcome.succeeded());
        ExternalApiLogger.logDelivery(log, channel.name(), describe(release), outcome.succeeded(),
            outcome.failureMessage().orElse(null));
        return outcome;
    }

    private boolean alreadyNotified(long releaseId) {
        return releaseStore.findRelease(releaseId).map(StoredRelease::notified).orElse(false);
    }

    private boolean calendarEnabled() {
        return properties.getNotification().getCalendar().isEnabled();
    }

    private static boolean isRetryable(RuntimeException failure) {
        return failure instanceof ChannelDeliveryException delivery && delivery.isRetryable();
    }

    private static String describe(StoredRelease release) {
        return release.id() + " " + release.workTitle() + " " + NotificationRenderer.numberLabel(release);
    }
}
