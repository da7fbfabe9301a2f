package net.releasewatch.exception;

import net.releasewatch.model.NotificationChannel;

/**
 * Raised by a notification channel adapter when delivery fails.
 */
public class ChannelDeliveryException extends RuntimeException {

    private final NotificationChannel channel;
    private final boolean retryable;

    public ChannelDeliveryException(NotificationChannel channel, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.channel = channel;
        this.retryable = retryable;
    }

    public ChannelDeliveryException(NotificationChannel channel, String message, boolean retryable) {
        this(channel, message, retryable, null);
    }

    public NotificationChannel getChannel() {
        return channel;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
