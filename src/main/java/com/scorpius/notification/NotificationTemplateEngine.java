package com.scorpius.notification;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.RenderedNotification;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Renders a payload for one channel.
 *
 * <p>The template is the channel's configured override when set, otherwise the built-in
 * entry of {@link NotificationTemplates} for the payload type. Variables are the payload
 * {@code data} plus {@code title}, {@code message}, {@code timestamp} and
 * {@code dashboardUrl}, the latter four taking precedence. Without a template the raw
 * message is used unchanged.
 */
@Component
public class NotificationTemplateEngine {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final NotificationProperties notificationProperties;
    private final Clock clock;

    public NotificationTemplateEngine(NotificationProperties notificationProperties, Clock clock) {
        this.notificationProperties = notificationProperties;
        this.clock = clock;
    }

    public RenderedNotification render(NotificationPayload payload, NotificationChannel channel, ChannelConfig config) {
        Optional<String> template = resolveTemplate(payload, channel, config);
        String body = template.map(t -> TemplateInterpolator.interpolate(t, variables(payload)))
                .orElse(payload.getMessage());
        return RenderedNotification.builder()
                .channel(channel)
                .title(resolveTitle(payload))
                .body(body)
                .templated(template.isPresent())
                .payload(payload)
                .build();
    }

    Map<String, Object> variables(NotificationPayload payload) {
        Map<String, Object> variables = new HashMap<>();
        if (payload.getData() != null) {
            variables.putAll(payload.getData());
        }
        variables.put("title", payload.getTitle());
        variables.put("message", payload.getMessage());
        variables.put("timestamp", TIME_FORMAT.format(payload.getTimestamp().atZone(clock.getZone())));
        variables.put("dashboardUrl", notificationProperties.getDashboardUrl());
        return variables;
    }

    private String resolveTitle(NotificationPayload payload) {
        if (payload.getTitle() != null && !payload.getTitle().isBlank()) {
            return payload.getTitle();
        }
        return payload.getType() != null ? NotificationTemplates.title(payload.getType()).orElse("") : "";
    }

    private Optional<String> resolveTemplate(NotificationPayload payload, NotificationChannel channel, ChannelConfig config) {
        if (config != null && config.getTemplate() != null && !config.getTemplate().isBlank()) {
            return Optional.of(config.getTemplate());
        }
        if (payload.getType() == null) {
            return Optional.empty();
        }
        return NotificationTemplates.body(payload.getType(), channel);
    }
}
