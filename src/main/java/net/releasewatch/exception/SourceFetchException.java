package net.releasewatch.exception;

/**
 * Typed failure of a call to an upstream release source.
 */
public class SourceFetchException extends RuntimeException {

    /**
     * Failure classification driving retry and circuit breaker decisions.
     */
    public enum Reason {
        /** Upstream signalled a rate limit, or the local budget could not be acquired in time. */
        RATE_LIMITED(true),
        /** 5xx response or connection-level failure. */
        UPSTREAM(true),
        /** Call exceeded its timeout. */
        TIMEOUT(true),
        /** Breaker rejected the call without contacting upstream. */
        CIRCUIT_OPEN(false),
        /** Client error or malformed payload; retrying cannot help. */
        NON_RETRYABLE(false);

        private final boolean transientFailure;

        Reason(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }

        public boolean isTransient() {
            return transientFailure;
        }
    }

    private final String sourceId;
    private final Reason reason;
    private final boolean upstreamContacted;

    public SourceFetchException(String sourceId, Reason reason, String message) {
        this(sourceId, reason, message, null, reason != Reason.CIRCUIT_OPEN);
    }

    public SourceFetchException(String sourceId, Reason reason, String message, Throwable cause) {
        this(sourceId, reason, message, cause, reason != Reason.CIRCUIT_OPEN);
    }

    private SourceFetchException(String sourceId,
                                 Reason reason,
                                 String message,
                                 Throwable cause,
                                 boolean upstreamContacted) {
        super("[" + sourceId + "] " + reason + ": " + message, cause);
        this.sourceId = sourceId;
        this.reason = reason;
        this.upstreamContacted = upstreamContacted;
    }

    /** Local budget exhaustion; upstream was never contacted. */
    public static SourceFetchException budgetExhausted(String sourceId, String message) {
        return new SourceFetchException(sourceId, Reason.RATE_LIMITED, message, null, false);
    }

    public String getSourceId() {
        return sourceId;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isTransient() {
        return reason.isTransient();
    }

    /**
     * Whether the failure came back from upstream. Local rejections (open breaker, exhausted
     * budget) must not be fed back into the breaker.
     */
    public boolean isUpstreamContacted() {
        return upstreamContacted;
    }
}
