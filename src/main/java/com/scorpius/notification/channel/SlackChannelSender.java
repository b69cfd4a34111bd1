package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.RenderedNotification;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Posts to a Slack incoming webhook: the title as {@code text} and the rendered body in one
 * attachment colored by priority.
 */
@Component
public class SlackChannelSender extends AbstractHttpChannelSender {

    public SlackChannelSender(@Qualifier("channelRestClient") RestClient restClient) {
        super(restClient);
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SLACK;
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
        Map<String, Object> attachment = Map.of(
                "color", PriorityColors.hex(notification.getPayload().getPriority()),
                "text", notification.getBody(),
                "ts", notification.getPayload().getTimestamp().getEpochSecond());
        return Map.of("text", notification.getTitle(), "attachments", List.of(attachment));
    }
}
