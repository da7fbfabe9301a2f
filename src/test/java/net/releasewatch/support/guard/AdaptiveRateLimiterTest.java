package net.releasewatch.support.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.testutil.MutableClock;
import net.releasewatch.testutil.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AdaptiveRateLimiterTest {

    private static final Instant START = Instant.parse("2025-04-01T00:00:00Z");

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private ReleaseWatchProperties.RateLimit settings;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        sleeper = new RecordingSleeper(clock);
        settings = new ReleaseWatchProperties.RateLimit();
    }

    @Test
    @DisplayName("admits up to the configured rate and waits for the oldest admission to leave the window")
    void should_WaitForWindow_When_BudgetConsumed() {
        settings.setBurstThreshold(1.0);
        AdaptiveRateLimiter limiter = limiter(5);

        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }
        assertThat(sleeper.sleeps()).isEmpty();

        limiter.acquire();

        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(60));
        assertThat(limiter.admittedInWindow()).isEqualTo(1);
    }

    @Test
    void should_ThrottleOnce_When_BurstRatioExceeded() {
        AdaptiveRateLimiter limiter = limiter(10);

        for (int i = 0; i < 7; i++) {
            limiter.acquire();
        }
        assertThat(limiter.effectiveRate()).isEqualTo(10.0);

        limiter.acquire();

        assertThat(limiter.effectiveRate()).isCloseTo(8.0, within(1e-9));
    }

    @Test
    void should_ThrottleAtMostOncePerWindow_When_BurstPersists() {
        settings.setBurstThreshold(0.05);
        AdaptiveRateLimiter limiter = limiter(100);

        for (int i = 0; i < 10; i++) {
            limiter.acquire();
        }

        assertThat(limiter.effectiveRate()).isCloseTo(80.0, within(1e-9));
    }

    @Test
    void should_FailWithRateLimited_When_WaitExceedsMaxWait() {
        settings.setBurstThreshold(1.0);
        settings.setMaxWait(Duration.ofSeconds(30));
        AdaptiveRateLimiter limiter = limiter(2);
        limiter.acquire();
        limiter.acquire();

        assertThatThrownBy(limiter::acquire)
            .isInstanceOfSatisfying(SourceFetchException.class, failure -> {
                assertThat(failure.getReason()).isEqualTo(SourceFetchException.Reason.RATE_LIMITED);
                assertThat(failure.isUpstreamContacted()).isFalse();
            });
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void should_RecoverSlowly_When_StableSuccessesFollowFailure() {
        AdaptiveRateLimiter limiter = limiter(10);
        limiter.recordTransientFailure();
        assertThat(limiter.effectiveRate()).isCloseTo(8.0, within(1e-9));

        for (int i = 0; i < 9; i++) {
            limiter.recordSuccess();
        }
        assertThat(limiter.effectiveRate()).isCloseTo(8.0, within(1e-9));

        limiter.recordSuccess();
        assertThat(limiter.effectiveRate()).isCloseTo(8.4, within(1e-9));

        for (int i = 0; i < 200; i++) {
            limiter.recordSuccess();
        }
        assertThat(limiter.effectiveRate()).isEqualTo(10.0);
    }

    @Test
    void should_NeverDropBelowFloor_When_FailuresRepeat() {
        AdaptiveRateLimiter limiter = limiter(3);

        for (int i = 0; i < 50; i++) {
            limiter.recordTransientFailure();
        }

        assertThat(limiter.effectiveRate()).isEqualTo(1.0);
        limiter.acquire();
        assertThat(limiter.admittedInWindow()).isEqualTo(1);
    }

    @Test
    @DisplayName("concurrent callers never exceed the per-minute budget")
    void should_HoldRollingBound_When_CallersRace() throws Exception {
        settings.setBurstThreshold(1.0);
        settings.setMaxWait(Duration.ofHours(1));
        int requestsPerMinute = 50;
        int threads = 8;
        int perThread = 20;
        AdaptiveRateLimiter limiter = limiter(requestsPerMinute);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    limiter.acquire();
                    assertThat(limiter.admittedInWindow()).isLessThanOrEqualTo(requestsPerMinute);
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        int total = threads * perThread;
        long minimumWindows = (total + requestsPerMinute - 1) / requestsPerMinute - 1;
        assertThat(Duration.between(START, clock.instant()))
            .isGreaterThanOrEqualTo(Duration.ofSeconds(60 * minimumWindows));
    }

    private AdaptiveRateLimiter limiter(int requestsPerMinute) {
        return new AdaptiveRateLimiter("test-source", requestsPerMinute, settings, clock, sleeper);
    }
}
