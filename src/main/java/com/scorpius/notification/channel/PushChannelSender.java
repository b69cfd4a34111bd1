package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.RenderedNotification;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Hands the notification to a push gateway. The payload id becomes the push {@code tag}.
 */
@Component
public class PushChannelSender extends AbstractHttpChannelSender {

    public PushChannelSender(@Qualifier("channelRestClient") RestClient restClient) {
        super(restClient);
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.PUSH;
    }

    @Override
    protected boolean hasRequiredConfig(ChannelConfig config) {
        return hasText(config.getWebhook());
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
        NotificationPayload payload = notification.getPayload();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", notification.getTitle());
        body.put("body", payload.getMessage());
        body.put("priority", payload.getPriority());
        body.put("tag", payload.getId());
        body.put("data", payload.getData() != null ? payload.getData() : Map.of());
        return body;
    }
}
