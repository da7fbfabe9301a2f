package net.releasewatch.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls to upstream sources and notification channels.
 *
 * Every line carries the {@code [EXTERNAL-API]} prefix so collection runs can be traced with a
 * single grep:
 * - AniList GraphQL (rate-limited source)
 * - RSS/Atom feeds
 * - Mail and calendar channels
 * - Release persistence outcomes
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log a call about to leave for an upstream source
     */
    public static void logApiCallAttempt(Logger log, String source, String operation, String target) {
        log.info(String.format("%s [%s] ATTEMPT: %s target='%s'", PREFIX, source, operation, target));
    }

    public static void logApiCallSuccess(Logger log, String source, String operation, String target, int itemCount) {
        log.info(String.format("%s [%s] SUCCESS: %s yielded %d item(s) target='%s'",
            PREFIX, source, operation, itemCount, target));
    }

    public static void logApiCallFailure(Logger log, String source, String operation, String target, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s target='%s' - %s", PREFIX, source, operation, target, reason));
    }

    /**
     * Log a call rejected locally because the source's breaker is open
     */
    public static void logCircuitBreakerBlocked(Logger log, String source, String target) {
        log.info(String.format("%s [%s] CIRCUIT-BREAKER-OPEN: call not sent target='%s'", PREFIX, source, target));
    }

    /**
     * Log the outcome of a notification channel sequence.
     */
    public static void logDelivery(Logger log, String channel, String releaseRef, boolean success, String detail) {
        String state = success ? "DELIVERED" : "FAILED";
        String suffix = detail != null && !detail.isBlank() ? " - " + detail : "";
        String message = String.format("%s [%s] %s: release='%s'%s", PREFIX, channel, state, releaseRef, suffix);
        if (success) {
            log.info(message);
        } else {
            log.warn(message);
        }
    }

    /**
     * Log a stored release. Known releases are logged at debug since every run sees them again.
     */
    public static void logPersistence(Logger log, String sourceId, long releaseId, boolean created, String dedupKey) {
        String message = String.format("%s [PERSISTENCE] %s %s: releaseId=%d, key='%s'",
            PREFIX, sourceId, created ? "CREATED" : "EXISTING", releaseId, dedupKey);
        if (created) {
            log.info(message);
        } else {
            log.debug(message);
        }
    }
}
