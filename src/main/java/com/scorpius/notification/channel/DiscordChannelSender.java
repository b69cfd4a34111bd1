package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.RenderedNotification;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Posts one embed to a Discord webhook. Every {@code data} entry becomes an inline field.
 */
@Component
public class DiscordChannelSender extends AbstractHttpChannelSender {

    public DiscordChannelSender(@Qualifier("channelRestClient") RestClient restClient) {
        super(restClient);
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.DISCORD;
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
        NotificationPayload payload = notification.getPayload();
        List<Map<String, Object>> fields = new ArrayList<>();
        if (payload.getData() != null) {
            payload.getData().forEach((key, value) ->
                    fields.add(Map.of("name", key, "value", String.valueOf(value), "inline", true)));
        }

        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", notification.getTitle());
        embed.put("description", payload.getMessage());
        embed.put("color", PriorityColors.rgb(payload.getPriority()));
        embed.put("timestamp", payload.getTimestamp().toString());
        embed.put("fields", fields);
        return Map.of("embeds", List.of(embed));
    }
}
