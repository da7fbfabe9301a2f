package net.releasewatch.support.guard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.model.CircuitState;

/**
 * Consecutive-failure circuit breaker for one upstream source.
 *
 * <p>Opens after {@code failureThreshold} consecutive transient failures. Once the cooldown has
 * elapsed exactly one caller wins the transition to HALF_OPEN and acts as the probe; everyone
 * else keeps getting CIRCUIT_OPEN until the probe reports back.</p>
 */
@Slf4j
public class SourceCircuitBreaker {

    private final String sourceId;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private final AtomicReference<CircuitState> circuitState = new AtomicReference<>(CircuitState.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicReference<Instant> openUntil = new AtomicReference<>();

    public SourceCircuitBreaker(String sourceId, int failureThreshold, Duration cooldown, Clock clock) {
        this.sourceId = sourceId;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * @throws SourceFetchException with reason CIRCUIT_OPEN when the call is not permitted
     */
    public void acquirePermission() {
        CircuitState currentState = circuitState.get();
        switch (currentState) {
            case CLOSED:
                return;
            case OPEN:
                Instant until = openUntil.get();
                if (until != null && !clock.instant().isBefore(until)
                    && circuitState.compareAndSet(CircuitState.OPEN, CircuitState.HALF_OPEN)) {
                    log.info("Circuit for {} HALF_OPEN after cooldown - letting one probe through", sourceId);
                    return;
                }
                throw rejection("circuit open until " + until);
            case HALF_OPEN:
            default:
                throw rejection("probe already in flight");
        }
    }

    /**
     * Gives back a permission that was granted but never used against upstream.
     */
    public void releasePermission() {
        if (circuitState.compareAndSet(CircuitState.HALF_OPEN, CircuitState.OPEN)) {
            log.debug("Probe for {} released unused; circuit back to OPEN", sourceId);
        }
    }

    public void onSuccess() {
        consecutiveFailures.set(0);
        if (circuitState.compareAndSet(CircuitState.HALF_OPEN, CircuitState.CLOSED)) {
            openUntil.set(null);
            log.info("Circuit for {} CLOSED after successful probe", sourceId);
        }
    }

    public void onTransientFailure() {
        int failures = consecutiveFailures.incrementAndGet();
        Instant reopenUntil = clock.instant().plus(cooldown);
        if (circuitState.get() == CircuitState.HALF_OPEN) {
            openUntil.set(reopenUntil);
            if (circuitState.compareAndSet(CircuitState.HALF_OPEN, CircuitState.OPEN)) {
                log.error("Probe for {} failed - circuit re-OPENED until {}", sourceId, reopenUntil);
            }
            return;
        }
        if (failures >= failureThreshold && circuitState.get() == CircuitState.CLOSED) {
            openUntil.set(reopenUntil);
            if (circuitState.compareAndSet(CircuitState.CLOSED, CircuitState.OPEN)) {
                log.error("Circuit for {} OPENED after {} consecutive failures - blocking calls until {}",
                    sourceId, failures, reopenUntil);
            }
        }
    }

    /**
     * A non-retryable answer still proves upstream is reachable, so a probe ending this way
     * closes the breaker. In CLOSED state it changes nothing.
     */
    public void onNonRetryableFailure() {
        if (circuitState.compareAndSet(CircuitState.HALF_OPEN, CircuitState.CLOSED)) {
            consecutiveFailures.set(0);
            openUntil.set(null);
            log.info("Circuit for {} CLOSED - probe reached upstream", sourceId);
        }
    }

    public CircuitState state() {
        return circuitState.get();
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    public Instant openUntil() {
        return circuitState.get() == CircuitState.CLOSED ? null : openUntil.get();
    }

    private SourceFetchException rejection(String detail) {
        log.debug("Circuit for {} rejected call: {}", sourceId, detail);
        return new SourceFetchException(sourceId, SourceFetchException.Reason.CIRCUIT_OPEN, detail);
    }
}
