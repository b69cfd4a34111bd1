package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.ToastLevel;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.InAppNotification;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.RenderedNotification;
import com.scorpius.event.EventPublisherHelper;
import com.scorpius.notification.InAppNotificationCenter;
import com.scorpius.notification.NotificationProperties;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Delivers in-app: records the toast in the {@link InAppNotificationCenter} and publishes an
 * {@link com.scorpius.notification.InAppNotificationEvent} for the UI bridge.
 *
 * <p>Toast level follows priority (critical: error, high: warning, normal: success,
 * low: info); critical toasts stay up for 10 seconds, all others for 5.
 */
@Component
public class InAppChannelSender implements ChannelSender {

    private static final Logger log = LoggerFactory.getLogger(InAppChannelSender.class);

    static final long CRITICAL_DURATION_MS = 10_000;
    static final long DEFAULT_DURATION_MS = 5_000;

    private final EventPublisherHelper eventPublisherHelper;
    private final InAppNotificationCenter inAppNotificationCenter;
    private final NotificationProperties notificationProperties;
    private final Clock clock;

    public InAppChannelSender(
            EventPublisherHelper eventPublisherHelper,
            InAppNotificationCenter inAppNotificationCenter,
            NotificationProperties notificationProperties,
            Clock clock) {
        this.eventPublisherHelper = eventPublisherHelper;
        this.inAppNotificationCenter = inAppNotificationCenter;
        this.notificationProperties = notificationProperties;
        this.clock = clock;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.IN_APP;
    }

    @Override
    public boolean send(ChannelConfig config, RenderedNotification notification) {
        try {
            NotificationPayload payload = notification.getPayload();
            InAppNotification toast = InAppNotification.builder()
                    .id(payload.getId())
                    .type(payload.getType())
                    .title(notification.getTitle())
                    .message(payload.getMessage())
                    .priority(payload.getPriority())
                    .level(ToastLevel.forPriority(payload.getPriority()))
                    .durationMs(payload.getPriority() == NotificationPriority.CRITICAL
                            ? CRITICAL_DURATION_MS
                            : DEFAULT_DURATION_MS)
                    .showNative(notificationProperties.getInApp().isNativeNotifications())
                    .receivedAt(clock.instant())
                    .build();

            inAppNotificationCenter.record(toast);
            eventPublisherHelper.publishInAppNotification(this, toast);
            log.debug("In-app notification sent: {}", toast.getTitle());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to send in-app notification: {}", e.getMessage());
            return false;
        }
    }
}
