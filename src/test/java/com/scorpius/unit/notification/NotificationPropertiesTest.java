package com.scorpius.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.NotificationPreferences;
import com.scorpius.domain.model.RateLimit;
import com.scorpius.notification.NotificationProperties;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class NotificationPropertiesTest {

    @Test
    void toPreferences_unconfigured_matchesDefaults() {
        NotificationPreferences preferences = new NotificationProperties().toPreferences();
        NotificationPreferences defaults = NotificationPreferences.createDefault();

        assertThat(preferences.getChannels()).isEqualTo(defaults.getChannels());
        assertThat(preferences.getTypes()).isEqualTo(defaults.getTypes());
        assertThat(preferences.getQuietHours().isEnabled()).isFalse();
        assertThat(preferences.getFilters().getMinPriority()).isEqualTo(NotificationPriority.LOW);
    }

    @Test
    void toPreferences_configuredChannel_overridesDefaultWithRateLimit() {
        NotificationProperties properties = new NotificationProperties();
        NotificationProperties.Channel slack = new NotificationProperties.Channel();
        slack.setEnabled(true);
        slack.setWebhook("https://hooks.slack.test/x");
        slack.setMaxPerHour(30);
        slack.setMaxPerDay(200);
        properties.getChannels().put(NotificationChannel.SLACK, slack);

        ChannelConfig config = properties.toPreferences().channelConfig(NotificationChannel.SLACK);

        assertThat(config.isEnabled()).isTrue();
        assertThat(config.getWebhook()).isEqualTo("https://hooks.slack.test/x");
        assertThat(config.getRateLimit()).isEqualTo(RateLimit.of(30, 200));
        assertThat(properties.toPreferences().isChannelEnabled(NotificationChannel.IN_APP)).isTrue();
    }

    @Test
    void toPreferences_onlyHourlyLimit_unlimited() {
        NotificationProperties properties = new NotificationProperties();
        NotificationProperties.Channel telegram = new NotificationProperties.Channel();
        telegram.setEnabled(true);
        telegram.setMaxPerHour(10);
        properties.getChannels().put(NotificationChannel.TELEGRAM, telegram);

        assertThat(properties.toPreferences().channelConfig(NotificationChannel.TELEGRAM).getRateLimit()).isNull();
    }

    @Test
    void toPreferences_typeRoutingAndQuietHours() {
        NotificationProperties properties = new NotificationProperties();
        properties.getTypes().put(
                NotificationType.MEV_OPPORTUNITY, List.of(NotificationChannel.IN_APP, NotificationChannel.DISCORD));
        properties.getQuietHours().setEnabled(true);
        properties.getQuietHours().setStart(LocalTime.of(23, 0));
        properties.getQuietHours().setTimezone("Europe/Berlin");
        properties.getFilters().setMinPriority(NotificationPriority.HIGH);

        NotificationPreferences preferences = properties.toPreferences();

        assertThat(preferences.channelsFor(NotificationType.MEV_OPPORTUNITY))
                .containsExactlyInAnyOrder(NotificationChannel.IN_APP, NotificationChannel.DISCORD);
        assertThat(preferences.channelsFor(NotificationType.SCAN_COMPLETED)).containsExactly(NotificationChannel.IN_APP);
        assertThat(preferences.getQuietHours().getStart()).isEqualTo(LocalTime.of(23, 0));
        assertThat(preferences.getQuietHours().getTimezone()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(preferences.getFilters().getMinPriority()).isEqualTo(NotificationPriority.HIGH);
    }
}
