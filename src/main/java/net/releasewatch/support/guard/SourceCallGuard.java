package net.releasewatch.support.guard;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.exception.ReleaseWatchConfigurationException;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.model.SourceState;
import net.releasewatch.support.retry.BoundedRetrySupport;
import net.releasewatch.support.retry.BoundedRetrySupport.RetryConfig;
import net.releasewatch.support.retry.Sleeper;

/**
 * Wraps every upstream call of one source in its circuit breaker, rate limiter and bounded retry.
 *
 * <p>Only transient failures that actually reached upstream are retried and fed into the breaker
 * and the limiter. Local rejections (open circuit, exhausted budget) end the call at once.</p>
 */
@Slf4j
public class SourceCallGuard {

    private final String sourceId;
    private final AdaptiveRateLimiter rateLimiter;
    private final SourceCircuitBreaker circuitBreaker;
    private final RetryConfig retryConfig;

    public SourceCallGuard(String sourceId,
                           AdaptiveRateLimiter rateLimiter,
                           SourceCircuitBreaker circuitBreaker,
                           RetryConfig retryConfig) {
        this.sourceId = sourceId;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.retryConfig = retryConfig;
    }

    /**
     * Builds a guard for a source from the shared configuration.
     *
     * @param maxAttempts attempts per call, first try included
     */
    public static SourceCallGuard create(String sourceId,
                                         ReleaseWatchProperties properties,
                                         int maxAttempts,
                                         Clock clock,
                                         Sleeper sleeper) {
        return create(sourceId, properties, maxAttempts, properties.getSourceRetry().getInitialBackoff(), clock, sleeper);
    }

    /**
     * Same as {@link #create(String, ReleaseWatchProperties, int, Clock, Sleeper)} with a
     * source-specific first backoff. The cap still comes from {@code source-retry.max-backoff}.
     *
     * @throws ReleaseWatchConfigurationException when the budget or the attempt count is below 1
     */
    public static SourceCallGuard create(String sourceId,
                                         ReleaseWatchProperties properties,
                                         int maxAttempts,
                                         Duration initialBackoff,
                                         Clock clock,
                                         Sleeper sleeper) {
        List<String> problems = new ArrayList<>();
        if (properties.budgetFor(sourceId) < 1) {
            problems.add("source-budgets." + sourceId + " must be at least 1");
        }
        if (maxAttempts < 1) {
            problems.add("retry attempts for " + sourceId + " must be at least 1");
        }
        if (!problems.isEmpty()) {
            throw new ReleaseWatchConfigurationException(problems);
        }
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(
            sourceId, properties.budgetFor(sourceId), properties.getRateLimit(), clock, sleeper);
        SourceCircuitBreaker breaker = new SourceCircuitBreaker(
            sourceId,
            properties.getCircuitBreaker().getFailureThreshold(),
            properties.getCircuitBreaker().getCooldown(),
            clock);
        RetryConfig retry = new RetryConfig(
            log,
            maxAttempts,
            initialBackoff,
            properties.getSourceRetry().getMaxBackoff(),
            sleeper);
        return new SourceCallGuard(sourceId, limiter, breaker, retry);
    }

    /**
     * Executes the upstream call with breaker, budget and retry applied.
     *
     * @throws SourceFetchException the last failure once retries are exhausted or for any
     *                              failure that is not retried
     */
    public <T> T call(String operationLabel, Supplier<T> upstreamCall) {
        return BoundedRetrySupport.executeOrThrow(
            retryConfig,
            sourceId + " " + operationLabel,
            SourceCallGuard::isRetryable,
            () -> attempt(upstreamCall));
    }

    public SourceState state() {
        return new SourceState(
            sourceId,
            rateLimiter.effectiveRate(),
            circuitBreaker.consecutiveFailures(),
            circuitBreaker.state(),
            circuitBreaker.openUntil());
    }

    public String sourceId() {
        return sourceId;
    }

    private <T> T attempt(Supplier<T> upstreamCall) {
        circuitBreaker.acquirePermission();
        try {
            rateLimiter.acquire();
        } catch (RuntimeException budgetFailure) {
            circuitBreaker.releasePermission();
            throw budgetFailure;
        }
        try {
            T result = upstreamCall.get();
            circuitBreaker.onSuccess();
            rateLimiter.recordSuccess();
            return result;
        } catch (SourceFetchException failure) {
            recordFailure(failure);
            throw failure;
        } catch (RuntimeException unexpected) {
            SourceFetchException failure = new SourceFetchException(
                sourceId, SourceFetchException.Reason.NON_RETRYABLE, unexpected.getMessage(), unexpected);
            recordFailure(failure);
            throw failure;
        }
    }

    private void recordFailure(SourceFetchException failure) {
        if (!failure.isUpstreamContacted()) {
            circuitBreaker.releasePermission();
            return;
        }
        if (failure.isTransient()) {
            circuitBreaker.onTransientFailure();
            rateLimiter.recordTransientFailure();
        } else {
            circuitBreaker.onNonRetryableFailure();
        }
    }

    private static boolean isRetryable(RuntimeException failure) {
        return failure instanceof SourceFetchException fetchFailure
            && fetchFailure.isTransient()
            && fetchFailure.isUpstreamContacted();
    }
}
