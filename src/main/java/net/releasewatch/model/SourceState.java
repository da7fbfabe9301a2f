package net.releasewatch.model;

import java.time.Instant;

/**
 * Immutable snapshot of one source's rate limiter and circuit breaker state.
 *
 * @param sourceId            source the state belongs to
 * @param allowedRatePerMinute effective request budget after adaptive throttling
 * @param consecutiveFailures transient failures seen since the last success
 * @param circuitState        current breaker state
 * @param openUntil           end of the current cooldown, or {@code null} when not open
 */
public record SourceState(
    String sourceId,
    double allowedRatePerMinute,
    int consecutiveFailures,
    CircuitState circuitState,
    Instant openUntil
) {
}
