package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.RenderedNotification;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Sends a text message through an HTTP SMS gateway. {@code webhook} is the gateway URL,
 * {@code token} its API key (sent as bearer) and {@code chatId} the phone number.
 */
@Component
public class SmsChannelSender extends AbstractHttpChannelSender {

    public SmsChannelSender(@Qualifier("channelRestClient") RestClient restClient) {
        super(restClient);
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SMS;
    }

    @Override
    protected boolean hasRequiredConfig(ChannelConfig config) {
        return hasText(config.getWebhook()) && hasText(config.getChatId());
    }

    @Override
    protected String url(ChannelConfig config) {
        return config.getWebhook();
    }

    @Override
    protected String bearerToken(ChannelConfig config) {
        return hasText(config.getToken()) ? config.getToken() : null;
    }

    @Override
    protected Object body(ChannelConfig config, RenderedNotification notification) {
        return Map.of(
                "to", config.getChatId(),
                "message", notification.getTitle() + "\n" + notification.getPayload().getMessage());
    }
}
