package net.releasewatch.support.retry;

import java.util.Optional;

/**
 * Result of a bounded retry sequence: either a value or the last failure, plus the number of
 * attempts actually made.
 */
public record RetryOutcome<T>(T value, int attempts, RuntimeException failure) {

    public static <T> RetryOutcome<T> success(T value, int attempts) {
        return new RetryOutcome<>(value, attempts, null);
    }

    public static <T> RetryOutcome<T> failure(RuntimeException failure, int attempts) {
        return new RetryOutcome<>(null, attempts, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }

    public Optional<String> failureMessage() {
        return Optional.ofNullable(failure).map(RuntimeException::getMessage);
    }
}
