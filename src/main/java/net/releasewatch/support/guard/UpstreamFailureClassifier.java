package net.releasewatch.support.guard;

import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import net.releasewatch.exception.SourceFetchException;
import net.releasewatch.exception.SourceFetchException.Reason;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/**
 * Maps HTTP client failures onto {@link SourceFetchException} reasons.
 *
 * <ul>
 *   <li>429 is RATE_LIMITED, 5xx is UPSTREAM, any other status is NON_RETRYABLE</li>
 *   <li>timeouts anywhere in the cause chain are TIMEOUT</li>
 *   <li>connection and IO failures are UPSTREAM</li>
 *   <li>undecodable payloads are NON_RETRYABLE</li>
 * </ul>
 */
public final class UpstreamFailureClassifier {

    private UpstreamFailureClassifier() {
    }

    public static SourceFetchException classify(String sourceId, Throwable failure) {
        Throwable error = Exceptions.unwrap(failure);
        if (Exceptions.isRetryExhausted(error) && error.getCause() != null) {
            error = error.getCause();
        }
        if (error instanceof SourceFetchException fetchFailure) {
            return fetchFailure;
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status == 429) {
                return new SourceFetchException(sourceId, Reason.RATE_LIMITED, "HTTP 429 from upstream", response);
            }
            if (status >= 500) {
                return new SourceFetchException(sourceId, Reason.UPSTREAM, "HTTP " + status + " from upstream", response);
            }
            return new SourceFetchException(sourceId, Reason.NON_RETRYABLE, "HTTP " + status + " from upstream", response);
        }
        if (isTimeout(error)) {
            return new SourceFetchException(sourceId, Reason.TIMEOUT, "request timed out", error);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException
            || error.getCause() instanceof IOException) {
            return new SourceFetchException(sourceId, Reason.UPSTREAM, "connection failure: " + error.getMessage(), error);
        }
        if (error instanceof CodecException) {
            return new SourceFetchException(sourceId, Reason.NON_RETRYABLE, "unreadable payload: " + error.getMessage(), error);
        }
        return new SourceFetchException(sourceId, Reason.NON_RETRYABLE, String.valueOf(error.getMessage()), error);
    }

    /**
     * Whether the failure is worth another attempt at the HTTP level.
     */
    public static boolean isTransient(Throwable failure) {
        Throwable error = Exceptions.unwrap(failure);
        if (error instanceof WebClientResponseException response) {
            return response.getStatusCode().is5xxServerError() || response.getStatusCode().value() == 429;
        }
        return isTimeout(error) || error instanceof WebClientRequestException || error instanceof IOException;
    }

    private static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                || current instanceof ReadTimeoutException
                || current instanceof WriteTimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
