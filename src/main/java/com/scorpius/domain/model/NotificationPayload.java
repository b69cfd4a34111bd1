package com.scorpius.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A structured alert submitted to the {@link com.scorpius.notification.NotificationDispatcher}.
 *
 * <p>Immutable once built. The {@code id} identifies the payload for best-effort
 * redelivery checks; delivery is at-least-once, never exactly-once. The generic webhook
 * channel forwards this object unchanged as JSON.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationPayload {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    NotificationType type;
    String title;
    String message;

    @Builder.Default
    NotificationPriority priority = NotificationPriority.NORMAL;

    @Singular
    Set<NotificationChannel> channels;

    /** Template variables, merged under title/message/timestamp/dashboardUrl when rendering. */
    @Singular("dataEntry")
    Map<String, Object> data;

    /** Subject used in rate-limit keys; {@code global} when absent. */
    String userId;

    String teamId;

    @Builder.Default
    Instant timestamp = Instant.now();

    /** Payloads past this instant are dropped before enqueueing. */
    Instant expiresAt;

    NotificationMetadata metadata;

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
