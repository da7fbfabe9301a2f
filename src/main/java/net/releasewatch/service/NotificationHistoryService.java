package net.releasewatch.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.model.NotificationAttempt;
import net.releasewatch.model.NotificationChannel;
import net.releasewatch.repository.NotificationAttemptRepository;
import net.releasewatch.repository.NotificationAttemptRepository.ChannelStatistics;
import org.springframework.stereotype.Service;

/**
 * Read and append access to notification history, plus the next scheduled run time.
 */
@Slf4j
@Service
public class NotificationHistoryService {

    private final NotificationAttemptRepository repository;
    private final ReleaseWatchProperties properties;
    private final Clock clock;

    public NotificationHistoryService(NotificationAttemptRepository repository,
                                      ReleaseWatchProperties properties,
                                      Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public NotificationAttempt record(NotificationAttempt attempt) {
        NotificationAttempt stored = repository.append(attempt);
        if (!attempt.success()) {
            log.warn("{} attempt for release {} failed after {} tries: {}", attempt.channel(), attempt.releaseId(),
                attempt.attempts(), attempt.errorDetail());
        }
        return stored;
    }

    public Optional<NotificationAttempt> lastAttempt() {
        return repository.findLastAttempt();
    }

    public List<NotificationAttempt> recentFailures(int limit) {
        return repository.recentFailures(limit);
    }

    public boolean wasDelivered(long releaseId, NotificationChannel channel) {
        return repository.countSuccessful(releaseId, channel) > 0;
    }

    /**
     * Per-channel statistics for the trailing window ending now.
     */
    public Map<NotificationChannel, ChannelStatistics> statistics(Duration window) {
        Instant since = clock.instant().minus(window);
        return repository.statistics(since);
    }

    /**
     * Next time the external scheduler is configured to trigger a run, strictly after {@code now}.
     */
    public ZonedDateTime nextScheduledRun(Instant now) {
        ReleaseWatchProperties.Notification notification = properties.getNotification();
        ZonedDateTime current = now.atZone(properties.getZone());
        ZonedDateTime candidate = current.toLocalDate()
            .atTime(notification.getScheduleHour(), notification.getScheduleMinute())
            .atZone(properties.getZone());
        return candidate.isAfter(current) ? candidate : candidate.plusDays(1);
    }
}
