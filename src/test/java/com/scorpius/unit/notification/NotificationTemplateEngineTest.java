package com.scorpius.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.RenderedNotification;
import com.scorpius.notification.NotificationProperties;
import com.scorpius.notification.NotificationTemplateEngine;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for NotificationTemplateEngine: built-in templates, per-channel overrides,
 * fallback to the raw message, title resolution and the standard variables.
 */
class NotificationTemplateEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T14:30:05Z");

    private NotificationTemplateEngine engine;

    @BeforeEach
    void setUp() {
        NotificationProperties properties = new NotificationProperties();
        properties.setDashboardUrl("https://app.scorpius.test/dashboard");
        engine = new NotificationTemplateEngine(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static NotificationPayload.NotificationPayloadBuilder scanCompleted() {
        return NotificationPayload.builder()
                .type(NotificationType.SCAN_COMPLETED)
                .title("Scan s-1 done")
                .message("Scan finished with 2 issues")
                .priority(NotificationPriority.NORMAL)
                .timestamp(NOW)
                .dataEntry("scanId", "s-1")
                .dataEntry("duration", "42s")
                .dataEntry("issuesCount", 2);
    }

    @Test
    void render_builtInTemplate_interpolatesDataAndDashboardUrl() {
        RenderedNotification rendered = engine.render(
                scanCompleted().build(), NotificationChannel.TELEGRAM, ChannelConfig.enabledDefault());

        assertThat(rendered.isTemplated()).isTrue();
        assertThat(rendered.getBody())
                .contains("*Scan ID:* `s-1`")
                .contains("*Issues Found:* 2")
                .contains("[View Results](https://app.scorpius.test/dashboard)");
        assertThat(rendered.getTitle()).isEqualTo("Scan s-1 done");
        assertThat(rendered.getChannel()).isEqualTo(NotificationChannel.TELEGRAM);
    }

    @Test
    void render_channelWithoutTemplate_fallsBackToRawMessage() {
        RenderedNotification rendered = engine.render(
                scanCompleted().build(), NotificationChannel.DISCORD, ChannelConfig.enabledDefault());

        assertThat(rendered.isTemplated()).isFalse();
        assertThat(rendered.getBody()).isEqualTo("Scan finished with 2 issues");
    }

    @Test
    void render_typeWithoutTemplates_fallsBackToRawMessage() {
        NotificationPayload payload = scanCompleted().type(NotificationType.TEAM_MESSAGE).build();

        RenderedNotification rendered =
                engine.render(payload, NotificationChannel.SLACK, ChannelConfig.enabledDefault());

        assertThat(rendered.isTemplated()).isFalse();
        assertThat(rendered.getBody()).isEqualTo("Scan finished with 2 issues");
    }

    @Test
    void render_configTemplate_overridesBuiltIn() {
        ChannelConfig config = ChannelConfig.builder()
                .enabled(true)
                .webhook("https://hooks.slack.test/x")
                .template("{{title}} at {{timestamp}}: {{message}}")
                .build();

        RenderedNotification rendered = engine.render(scanCompleted().build(), NotificationChannel.SLACK, config);

        assertThat(rendered.isTemplated()).isTrue();
        assertThat(rendered.getBody()).isEqualTo("Scan s-1 done at 2026-03-02 14:30:05: Scan finished with 2 issues");
    }

    @Test
    void render_standardVariablesWinOverData() {
        ChannelConfig config = ChannelConfig.builder().enabled(true).template("{{title}}").build();
        NotificationPayload payload = scanCompleted().dataEntry("title", "from data").build();

        assertThat(engine.render(payload, NotificationChannel.SLACK, config).getBody()).isEqualTo("Scan s-1 done");
    }

    @Test
    void render_blankTitle_usesTypeTitle() {
        NotificationPayload payload = scanCompleted().title(null).build();

        RenderedNotification rendered =
                engine.render(payload, NotificationChannel.EMAIL, ChannelConfig.enabledDefault());

        assertThat(rendered.getTitle()).isEqualTo("✅ Scan Completed");
    }
}
