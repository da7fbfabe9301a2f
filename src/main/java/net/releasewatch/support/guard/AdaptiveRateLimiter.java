package net.releasewatch.support.guard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.support.retry.Sleeper;

/**
 * Sliding-window request budget for one upstream source.
 *
 * <p>Admissions are recorded in a 60 second rolling window. The effective rate starts at the
 * configured requests-per-minute, is throttled when the window fills past the burst threshold
 * or a transient failure is reported, and recovers slowly after runs of successes. It never
 * exceeds the configured rate, so no 60 second interval ever holds more admissions than that.</p>
 */
@Slf4j
public class AdaptiveRateLimiter {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final String sourceId;
    private final int requestsPerMinute;
    private final ReleaseWatchProperties.RateLimit settings;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> admissions = new ArrayDeque<>();
    private double effectiveRate;
    private int consecutiveSuccesses;
    private Instant lastBurstThrottle;

    public AdaptiveRateLimiter(String sourceId,
                               int requestsPerMinute,
                               ReleaseWatchProperties.RateLimit settings,
                               Clock clock,
                               Sleeper sleeper) {
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException("requestsPerMinute must be at least 1 for " + sourceId);
        }
        this.sourceId = sourceId;
        this.requestsPerMinute = requestsPerMinute;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
        this.effectiveRate = requestsPerMinute;
    }

    /**
     * Blocks until the window has room, then records the admission.
     *
     * @throws SourceFetchException with reason RATE_LIMITED when the wait would exceed max-wait
     */
    public void acquire() {
        Duration waited = Duration.ZERO;
        while (true) {
            Duration wait;
            lock.lock();
            try {
                Instant now = clock.instant();
                evictExpired(now);
                int limit = currentLimit();
                if (admissions.size() < limit) {
                    admissions.addLast(now);
                    throttleOnBurst(now, limit);
                    return;
                }
                wait = Duration.between(now, admissions.peekFirst().plus(WINDOW));
                if (wait.isNegative() || wait.isZero()) {
                    wait = Duration.ofMillis(1);
                }
                if (waited.plus(wait).compareTo(settings.getMaxWait()) > 0) {
                    log.warn("Rate limit budget for {} exhausted: {} admissions in window, limit {}, wait {}ms exceeds max {}ms",
                        sourceId, admissions.size(), limit, wait.toMillis(), settings.getMaxWait().toMillis());
                    throw SourceFetchException.budgetExhausted(sourceId,
                        "request budget exhausted; next slot in " + wait.toMillis() + "ms");
                }
            } finally {
                lock.unlock();
            }
            log.debug("Waiting {}ms for {} rate limit budget", wait.toMillis(), sourceId);
            sleeper.sleep(wait);
            waited = waited.plus(wait);
        }
    }

    public void recordSuccess() {
        lock.lock();
        try {
            consecutiveSuccesses++;
            if (consecutiveSuccesses % Math.max(1, settings.getStableWindowSuccesses()) == 0
                && effectiveRate < requestsPerMinute) {
                double previous = effectiveRate;
                effectiveRate = Math.min(requestsPerMinute, effectiveRate * settings.getRecoveryFactor());
                log.info("Rate for {} recovered from {} to {} requests/minute", sourceId,
                    format(previous), format(effectiveRate));
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordTransientFailure() {
        lock.lock();
        try {
            consecutiveSuccesses = 0;
            throttle("transient failure");
        } finally {
            lock.unlock();
        }
    }

    public double effectiveRate() {
        lock.lock();
        try {
            return effectiveRate;
        } finally {
            lock.unlock();
        }
    }

    /** Admissions inside the current window. */
    public int admittedInWindow() {
        lock.lock();
        try {
            evictExpired(clock.instant());
            return admissions.size();
        } finally {
            lock.unlock();
        }
    }

    private void throttleOnBurst(Instant now, int limit) {
        double ratio = (double) admissions.size() / limit;
        if (ratio <= settings.getBurstThreshold()) {
            return;
        }
        if (lastBurstThrottle != null && Duration.between(lastBurstThrottle, now).compareTo(WINDOW) < 0) {
            return;
        }
        lastBurstThrottle = now;
        throttle("burst ratio " + format(ratio));
    }

    private void throttle(String trigger) {
        double previous = effectiveRate;
        effectiveRate = Math.max(floor(), effectiveRate * settings.getThrottleFactor());
        if (previous != effectiveRate) {
            log.warn("Throttled {} from {} to {} requests/minute after {}", sourceId,
                format(previous), format(effectiveRate), trigger);
        }
    }

    private int currentLimit() {
        int limit = (int) Math.floor(effectiveRate);
        return Math.min(requestsPerMinute, Math.max(floor(), limit));
    }

    private int floor() {
        return Math.min(requestsPerMinute, Math.max(1, settings.getMinRequestsPerMinute()));
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!admissions.isEmpty() && !admissions.peekFirst().isAfter(cutoff)) {
            admissions.pollFirst();
        }
    }

    private static String format(double value) {
        return String.format("%.2f", value);
    }
}
