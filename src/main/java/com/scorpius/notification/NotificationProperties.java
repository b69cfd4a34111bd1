package com.scorpius.notification;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.NotificationFilters;
import com.scorpius.domain.model.NotificationPreferences;
import com.scorpius.domain.model.QuietHours;
import com.scorpius.domain.model.RateLimit;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Startup notification preferences.
 *
 * <p>Reads from application.yml:
 * <pre>
 * scorpius.notifications.dashboard-url=https://app.scorpius.io/dashboard
 * scorpius.notifications.channels.slack.enabled=true
 * scorpius.notifications.channels.slack.webhook=${SLACK_WEBHOOK_URL:}
 * scorpius.notifications.channels.slack.max-per-hour=30
 * scorpius.notifications.types.mev-opportunity=in_app,telegram
 * scorpius.notifications.quiet-hours.enabled=true
 * scorpius.notifications.filters.min-priority=normal
 * </pre>
 *
 * <p>Anything not configured keeps the value of {@link NotificationPreferences#createDefault()}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "scorpius.notifications")
public class NotificationProperties {

    /** Substituted for {{dashboardUrl}} in templates. */
    private String dashboardUrl = "http://localhost:3000/dashboard";

    /** Sender address of email notifications. */
    private String mailFrom = "notifications@scorpius.io";

    private Map<NotificationChannel, Channel> channels = new EnumMap<>(NotificationChannel.class);

    private Map<NotificationType, List<NotificationChannel>> types = new EnumMap<>(NotificationType.class);

    private QuietHoursProperties quietHours = new QuietHoursProperties();

    private Filters filters = new Filters();

    private InApp inApp = new InApp();

    public NotificationPreferences toPreferences() {
        NotificationPreferences defaults = NotificationPreferences.createDefault();

        Map<NotificationChannel, ChannelConfig> channelConfigs = new EnumMap<>(defaults.getChannels());
        channels.forEach((channel, properties) -> channelConfigs.put(channel, properties.toChannelConfig()));

        Map<NotificationType, Set<NotificationChannel>> routing = new EnumMap<>(defaults.getTypes());
        types.forEach((type, routed) -> routing.put(type, Set.copyOf(new LinkedHashSet<>(routed))));

        return defaults.toBuilder()
                .channels(Map.copyOf(channelConfigs))
                .types(Map.copyOf(routing))
                .quietHours(quietHours.toQuietHours())
                .filters(filters.toFilters())
                .build();
    }

    @Data
    public static class Channel {

        private boolean enabled;
        private String webhook;
        private String token;
        private String chatId;
        private String email;
        private String template;

        /** Both limits must be set for rate limiting to apply. */
        private Integer maxPerHour;

        private Integer maxPerDay;

        ChannelConfig toChannelConfig() {
            return ChannelConfig.builder()
                    .enabled(enabled)
                    .webhook(webhook)
                    .token(token)
                    .chatId(chatId)
                    .email(email)
                    .template(template)
                    .rateLimit(maxPerHour != null && maxPerDay != null ? RateLimit.of(maxPerHour, maxPerDay) : null)
                    .build();
        }
    }

    @Data
    public static class QuietHoursProperties {

        private boolean enabled = false;
        private LocalTime start = LocalTime.of(22, 0);
        private LocalTime end = LocalTime.of(8, 0);

        /** IANA zone id; the system zone when blank. */
        private String timezone;

        QuietHours toQuietHours() {
            return QuietHours.builder()
                    .enabled(enabled)
                    .start(start)
                    .end(end)
                    .timezone(timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone))
                    .build();
        }
    }

    @Data
    public static class Filters {

        private NotificationPriority minPriority = NotificationPriority.LOW;
        private List<String> keywords = new ArrayList<>();
        private List<String> excludeKeywords = new ArrayList<>();

        NotificationFilters toFilters() {
            return NotificationFilters.builder()
                    .minPriority(minPriority)
                    .keywords(keywords)
                    .excludeKeywords(excludeKeywords)
                    .build();
        }
    }

    @Data
    public static class InApp {

        /** Number of recent in-app notifications kept for the notification center. */
        private int historySize = 100;

        /** Ask the UI to raise a native desktop notification alongside the toast. */
        private boolean nativeNotifications = true;
    }
}
