package net.releasewatch.support.retry;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Executes an operation with a bounded number of attempts and capped exponential-random backoff.
 */
public final class BoundedRetrySupport {

    private static final double BACKOFF_MULTIPLIER = 2.0d;
    private static final double RANDOMIZATION_FACTOR = 0.5d;

    /**
     * Retry parameters that are constant per call site.
     */
    public record RetryConfig(Logger logger,
                              int maxAttempts,
                              Duration initialBackoff,
                              Duration maxBackoff,
                              Sleeper sleeper) {

        public RetryConfig {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
            }
            if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
                initialBackoff = Duration.ofMillis(1);
            }
            if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
                maxBackoff = initialBackoff;
            }
            if (sleeper == null) {
                sleeper = Sleeper.THREAD;
            }
        }

        IntervalFunction intervalFunction() {
            return IntervalFunction.ofExponentialRandomBackoff(
                initialBackoff.toMillis(), BACKOFF_MULTIPLIER, RANDOMIZATION_FACTOR);
        }
    }

    private BoundedRetrySupport() {
    }

    /**
     * Runs the action until it succeeds, throws a failure the predicate rejects, or runs out of
     * attempts. Never throws; the outcome carries the last failure instead.
     */
    public static <T> RetryOutcome<T> execute(RetryConfig config,
                                              String operationLabel,
                                              Predicate<RuntimeException> retryable,
                                              Supplier<T> action) {
        IntervalFunction intervals = config.intervalFunction();
        long capMillis = config.maxBackoff().toMillis();
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            try {
                return RetryOutcome.success(action.get(), attempt);
            } catch (RuntimeException failure) {
                lastFailure = failure;
                if (!retryable.test(failure)) {
                    config.logger().warn("{} failed with a non-retryable error on attempt {}: {}",
                        operationLabel, attempt, failure.getMessage());
                    return RetryOutcome.failure(failure, attempt);
                }
                if (attempt < config.maxAttempts()) {
                    long backoff = Math.min(capMillis, intervals.apply(attempt));
                    config.logger().warn("{} failed (attempt {}/{}). Retrying in {}ms: {}",
                        operationLabel, attempt, config.maxAttempts(), backoff, failure.getMessage());
                    config.sleeper().sleep(Duration.ofMillis(backoff));
                }
            }
        }
        config.logger().error("{} failed after {} attempts: {}",
            operationLabel, config.maxAttempts(), lastFailure.getMessage());
        return RetryOutcome.failure(lastFailure, config.maxAttempts());
    }

    /**
     * Same as {@link #execute} but rethrows the last failure.
     */
    public static <T> T executeOrThrow(RetryConfig config,
                                       String operationLabel,
                                       Predicate<RuntimeException> retryable,
                                       Supplier<T> action) {
        RetryOutcome<T> outcome = execute(config, operationLabel, retryable, action);
        if (!outcome.succeeded()) {
            throw outcome.failure();
        }
        return outcome.value();
    }
}
