package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.RenderedNotification;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Forwards the whole payload, unrendered, as JSON. */
@Component
public class WebhookChannelSender extends AbstractHttpChannelSender {

    public WebhookChannelSender(@Qualifier("channelRestClient") RestClient restClient) {
        super(restClient);
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WEBHOOK;
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
    protected Object body(ChannelConfig config, RenderedNotification notification) {
        return notification.getPayload();
    }
}
