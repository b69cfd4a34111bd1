package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.RenderedNotification;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Sends messages through the Telegram Bot API ({@code sendMessage}) in Markdown parse mode.
 * Needs the bot token and the target chat id.
 */
@Component
public class TelegramChannelSender extends AbstractHttpChannelSender {

    private static final String TELEGRAM_API_URL = "https://api.telegram.org/bot%s/sendMessage";

    public TelegramChannelSender(@Qualifier("channelRestClient") RestClient restClient) {
        super(restClient);
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.TELEGRAM;
    }

    @Override
    protected boolean hasRequiredConfig(ChannelConfig config) {
        return hasText(config.getToken()) && hasText(config.getChatId());
    }

    @Override
    protected String url(ChannelConfig config) {
        return String.format(TELEGRAM_API_URL, config.getToken());
    }

    @Override
    protected Object body(ChannelConfig config, RenderedNotification notification) {
        return Map.of(
                "chat_id",
                config.getChatId(),
                "text",
                notification.getBody(),
                "parse_mode",
                "Markdown",
                "disable_web_page_preview",
                false);
    }
}
