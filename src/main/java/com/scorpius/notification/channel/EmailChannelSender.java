package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.RenderedNotification;
import com.scorpius.notification.NotificationProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * Sends an HTML email through Spring Mail. The mail sender only exists when
 * {@code spring.mail.host} is configured; without it, or without a recipient address,
 * the channel reports failure.
 */
@Component
public class EmailChannelSender implements ChannelSender {

    private static final Logger log = LoggerFactory.getLogger(EmailChannelSender.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final NotificationProperties notificationProperties;

    public EmailChannelSender(
            ObjectProvider<JavaMailSender> mailSenderProvider, NotificationProperties notificationProperties) {
        this.mailSenderProvider = mailSenderProvider;
        this.notificationProperties = notificationProperties;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public boolean send(ChannelConfig config, RenderedNotification notification) {
        if (config == null || config.getEmail() == null || config.getEmail().isBlank()) {
            log.debug("Email channel has no recipient, skipping {}", notification.getPayload().getId());
            return false;
        }
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            log.warn("Email notification skipped, no mail sender configured (spring.mail.host)");
            return false;
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(notificationProperties.getMailFrom());
            helper.setTo(config.getEmail());
            helper.setSubject(notification.getTitle());
            helper.setText(notification.getBody(), notification.isTemplated());
            mailSender.send(message);
            log.debug("Email notification sent to {}: {}", config.getEmail(), notification.getTitle());
            return true;
        } catch (MessagingException | RuntimeException e) {
            log.error("Failed to send email notification: {}", e.getMessage());
            return false;
        }
    }
}
