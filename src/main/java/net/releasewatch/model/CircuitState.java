package net.releasewatch.model;

/**
 * Circuit breaker states for a single upstream source.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
