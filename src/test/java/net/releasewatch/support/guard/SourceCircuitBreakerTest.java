package net.releasewatch.support.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.model.CircuitState;
import net.releasewatch.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SourceCircuitBreakerTest {

    private static final Duration COOLDOWN = Duration.ofSeconds(60);

    private MutableClock clock;
    private SourceCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-04-01T00:00:00Z"));
        breaker = new SourceCircuitBreaker("anilist", 5, COOLDOWN, clock);
    }

    @Test
    void should_StayClosed_When_FailuresBelowThreshold() {
        for (int i = 0; i < 4; i++) {
            breaker.onTransientFailure();
        }

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThatCode(breaker::acquirePermission).doesNotThrowAnyException();
    }

    @Test
    void should_ResetFailureCount_When_SuccessInterleaves() {
        for (int i = 0; i < 4; i++) {
            breaker.onTransientFailure();
        }
        breaker.onSuccess();
        for (int i = 0; i < 4; i++) {
            breaker.onTransientFailure();
        }

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void should_OpenAndReject_When_ThresholdReached() {
        openBreaker();

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.openUntil()).isEqualTo(clock.instant().plus(COOLDOWN));
        assertThatThrownBy(breaker::acquirePermission)
            .isInstanceOfSatisfying(SourceFetchException.class, failure -> {
                assertThat(failure.getReason()).isEqualTo(SourceFetchException.Reason.CIRCUIT_OPEN);
                assertThat(failure.isUpstreamContacted()).isFalse();
            });
    }

    @Test
    void should_AllowSingleProbe_When_CooldownElapsed() {
        openBreaker();
        clock.advance(COOLDOWN);

        assertThatCode(breaker::acquirePermission).doesNotThrowAnyException();
        assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThatThrownBy(breaker::acquirePermission).isInstanceOf(SourceFetchException.class);
    }

    @Test
    void should_Close_When_ProbeSucceeds() {
        openBreaker();
        clock.advance(COOLDOWN);
        breaker.acquirePermission();

        breaker.onSuccess();

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.consecutiveFailures()).isZero();
        assertThat(breaker.openUntil()).isNull();
    }

    @Test
    void should_ReopenWithFreshCooldown_When_ProbeFails() {
        openBreaker();
        clock.advance(COOLDOWN);
        breaker.acquirePermission();

        breaker.onTransientFailure();

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.openUntil()).isEqualTo(clock.instant().plus(COOLDOWN));
        clock.advance(COOLDOWN.minusSeconds(1));
        assertThatThrownBy(breaker::acquirePermission).isInstanceOf(SourceFetchException.class);
    }

    @Test
    void should_Close_When_ProbeEndsNonRetryable() {
        openBreaker();
        clock.advance(COOLDOWN);
        breaker.acquirePermission();

        breaker.onNonRetryableFailure();

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void should_ReturnToOpen_When_ProbePermissionReleasedUnused() {
        openBreaker();
        clock.advance(COOLDOWN);
        breaker.acquirePermission();

        breaker.releasePermission();

        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThatCode(breaker::acquirePermission).doesNotThrowAnyException();
    }

    @Test
    void should_GrantExactlyOneProbe_When_CallersRaceAfterCooldown() throws Exception {
        openBreaker();
        clock.advance(COOLDOWN);
        int callers = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(pool.submit(() -> {
                start.await();
                try {
                    breaker.acquirePermission();
                    return true;
                } catch (SourceFetchException rejected) {
                    return false;
                }
            }));
        }
        start.countDown();

        int granted = 0;
        for (Future<Boolean> result : results) {
            if (result.get(10, TimeUnit.SECONDS)) {
                granted++;
            }
        }
        pool.shutdown();

        assertThat(granted).isEqualTo(1);
    }

    private void openBreaker() {
        for (int i = 0; i < 5; i++) {
            breaker.onTransientFailure();
        }
    }
}
