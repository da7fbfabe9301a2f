package net.releasewatch.adapters.mail;

import lombok.extern.slf4j.Slf4j;
import net.releasewatch.config.ReleaseWatchProperties;
import net.releasewatch.exception.ChannelDeliveryException;
import net.releasewatch.model.NotificationChannel;
import net.releasewatch.service.ReleaseMailSender;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Plain-text mail delivery through Spring's {@link JavaMailSender}.
 */
@Slf4j
@Component
public class SmtpReleaseMailSender implements ReleaseMailSender {

    private final JavaMailSender javaMailSender;
    private final ReleaseWatchProperties properties;

    public SmtpReleaseMailSender(JavaMailSender javaMailSender, ReleaseWatchProperties properties) {
        this.javaMailSender = javaMailSender;
        this.properties = properties;
    }

    @Override
    public void send(String recipient, String subject, String body) {
        SimpleMailMessage message = new SimpleMailMessage();
        String sender = properties.getNotification().getSender();
        message.setFrom(sender != null && !sender.isBlank() ? sender : recipient);
        message.setTo(recipient);
        message.setSubject(subject);
        message.setText(body);
        try {
            javaMailSender.send(message);
            log.debug("Mail '{}' handed to SMTP for {}", subject, recipient);
        } catch (MailAuthenticationException | MailParseException | MailPreparationException e) {
            throw new ChannelDeliveryException(NotificationChannel.EMAIL,
                "Mail rejected: " + e.getMessage(), false, e);
        } catch (MailException e) {
            throw new ChannelDeliveryException(NotificationChannel.EMAIL,
                "Mail delivery failed: " + e.getMessage(), true, e);
        }
    }
}
