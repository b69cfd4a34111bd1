package com.scorpius.domain.model;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationType;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the process-wide notification preferences.
 *
 * <p>Owned by {@link com.scorpius.notification.NotificationPreferencesStore}, which swaps the
 * whole snapshot on update so that a payload in flight always sees one consistent view.
 */
@Value
@Builder(toBuilder = true)
public class NotificationPreferences {

    Map<NotificationChannel, ChannelConfig> channels;

    /** Default channel routing per notification type. */
    Map<NotificationType, Set<NotificationChannel>> types;

    QuietHours quietHours;
    NotificationFilters filters;

    public ChannelConfig channelConfig(NotificationChannel channel) {
        ChannelConfig config = channels != null ? channels.get(channel) : null;
        return config != null ? config : ChannelConfig.disabled();
    }

    public boolean isChannelEnabled(NotificationChannel channel) {
        return channelConfig(channel).isEnabled();
    }

    public Set<NotificationChannel> channelsFor(NotificationType type) {
        Set<NotificationChannel> routed = types != null ? types.get(type) : null;
        return routed != null ? routed : Set.of(NotificationChannel.IN_APP);
    }

    /**
     * Returns a copy with one channel's configuration replaced.
     */
    public NotificationPreferences withChannel(NotificationChannel channel, ChannelConfig config) {
        Map<NotificationChannel, ChannelConfig> updated = new EnumMap<>(NotificationChannel.class);
        if (channels != null) {
            updated.putAll(channels);
        }
        updated.put(channel, config);
        return toBuilder().channels(Map.copyOf(updated)).build();
    }

    /**
     * Defaults: only in-app enabled, quiet hours off (22:00 to 08:00 in the system zone),
     * no priority or keyword filtering.
     */
    public static NotificationPreferences createDefault() {
        Map<NotificationChannel, ChannelConfig> channels = new EnumMap<>(NotificationChannel.class);
        for (NotificationChannel channel : NotificationChannel.values()) {
            channels.put(channel, ChannelConfig.disabled());
        }
        channels.put(NotificationChannel.IN_APP, ChannelConfig.enabledDefault());

        Map<NotificationType, Set<NotificationChannel>> types = new EnumMap<>(NotificationType.class);
        types.put(
                NotificationType.VULNERABILITY_FOUND,
                Set.of(NotificationChannel.IN_APP, NotificationChannel.EMAIL, NotificationChannel.SLACK));
        types.put(NotificationType.SCAN_COMPLETED, Set.of(NotificationChannel.IN_APP));
        types.put(NotificationType.MEV_OPPORTUNITY, Set.of(NotificationChannel.IN_APP, NotificationChannel.TELEGRAM));
        types.put(NotificationType.THRESHOLD_BREACH, Set.of(NotificationChannel.IN_APP, NotificationChannel.EMAIL));
        types.put(NotificationType.SYSTEM_ALERT, Set.of(NotificationChannel.IN_APP, NotificationChannel.EMAIL));
        types.put(NotificationType.TEAM_MESSAGE, Set.of(NotificationChannel.IN_APP));
        types.put(NotificationType.USER_ACTION, Set.of(NotificationChannel.IN_APP));
        types.put(
                NotificationType.SECURITY_WARNING,
                Set.of(NotificationChannel.IN_APP, NotificationChannel.EMAIL, NotificationChannel.SLACK));

        return NotificationPreferences.builder()
                .channels(Map.copyOf(channels))
                .types(Map.copyOf(types))
                .quietHours(QuietHours.builder().enabled(false).build())
                .filters(NotificationFilters.builder().build())
                .build();
    }
}
