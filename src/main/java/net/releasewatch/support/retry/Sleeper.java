package net.releasewatch.support.retry;

import java.time.Duration;

/**
 * Blocking pause used between retry attempts and while waiting for rate limit budget.
 * Tests substitute a recording implementation so backoff never really sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        try {
            Thread.sleep(Math.max(0L, duration.toMillis()));
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting " + duration, interruptedException);
        }
    };

    void sleep(Duration duration);
}
