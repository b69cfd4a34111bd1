package com.scorpius.unit.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import com.scorpius.domain.enums.ToastLevel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.InAppNotification;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.RenderedNotification;
import com.scorpius.event.EventPublisherHelper;
import com.scorpius.notification.InAppNotificationCenter;
import com.scorpius.notification.InAppNotificationEvent;
import com.scorpius.notification.NotificationProperties;
import com.scorpius.notification.channel.InAppChannelSender;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for InAppChannelSender: toast level and duration per priority, history
 * recording and event publication.
 */
@ExtendWith(MockitoExtension.class)
class InAppChannelSenderTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private InAppNotificationCenter inAppNotificationCenter;
    private InAppChannelSender inAppChannelSender;

    @BeforeEach
    void setUp() {
        NotificationProperties properties = new NotificationProperties();
        inAppNotificationCenter = new InAppNotificationCenter(properties);
        inAppChannelSender = new InAppChannelSender(
                new EventPublisherHelper(applicationEventPublisher),
                inAppNotificationCenter,
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RenderedNotification rendered(NotificationPriority priority) {
        return RenderedNotification.builder()
                .channel(NotificationChannel.IN_APP)
                .title("Threshold breached")
                .body("gas above 200 gwei")
                .payload(NotificationPayload.builder()
                        .id("n-7")
                        .type(NotificationType.THRESHOLD_BREACH)
                        .title("Threshold breached")
                        .message("gas above 200 gwei")
                        .priority(priority)
                        .build())
                .build();
    }

    @Test
    void send_critical_errorToastForTenSeconds() {
        assertThat(inAppChannelSender.send(ChannelConfig.enabledDefault(), rendered(NotificationPriority.CRITICAL)))
                .isTrue();

        InAppNotification toast = inAppNotificationCenter.getRecent().get(0);
        assertThat(toast.getId()).isEqualTo("n-7");
        assertThat(toast.getLevel()).isEqualTo(ToastLevel.ERROR);
        assertThat(toast.getDurationMs()).isEqualTo(10_000);
        assertThat(toast.isShowNative()).isTrue();
        assertThat(toast.getReceivedAt()).isEqualTo(NOW);
        assertThat(inAppNotificationCenter.getUnreadCount()).isEqualTo(1);
    }

    @Test
    void send_normal_successToastForFiveSeconds() {
        inAppChannelSender.send(ChannelConfig.enabledDefault(), rendered(NotificationPriority.NORMAL));

        InAppNotification toast = inAppNotificationCenter.getRecent().get(0);
        assertThat(toast.getLevel()).isEqualTo(ToastLevel.SUCCESS);
        assertThat(toast.getDurationMs()).isEqualTo(5_000);
    }

    @Test
    void send_publishesInAppEvent() {
        inAppChannelSender.send(ChannelConfig.enabledDefault(), rendered(NotificationPriority.HIGH));

        ArgumentCaptor<InAppNotificationEvent> event = ArgumentCaptor.forClass(InAppNotificationEvent.class);
        verify(applicationEventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getNotification().getLevel()).isEqualTo(ToastLevel.WARNING);
        assertThat(event.getValue().getNotification().getMessage()).isEqualTo("gas above 200 gwei");
    }

    @Test
    void send_publisherFails_false() {
        doThrow(new IllegalStateException("context closed"))
                .when(applicationEventPublisher)
                .publishEvent(any(ApplicationEvent.class));

        assertThat(inAppChannelSender.send(ChannelConfig.enabledDefault(), rendered(NotificationPriority.LOW)))
                .isFalse();
    }
}
