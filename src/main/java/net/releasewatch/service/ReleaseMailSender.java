package net.releasewatch.service;

import net.releasewatch.exception.ChannelDeliveryException;

/**
 * Primary notification channel.
 */
public interface ReleaseMailSender {

    /**
     * @throws ChannelDeliveryException when the message was not accepted
     */
    void send(String recipient, String subject, String body);
}
