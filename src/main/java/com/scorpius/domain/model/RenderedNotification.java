package com.scorpius.domain.model;

import com.scorpius.domain.enums.NotificationChannel;
import lombok.Builder;
import lombok.Value;

/**
 * A payload rendered for one channel: the template output (or raw message) plus the
 * original payload for adapters that forward structured fields.
 */
@Value
@Builder
public class RenderedNotification {

    NotificationChannel channel;
    String title;
    String body;

    /** True when {@link #body} came from a template rather than the raw message. */
    boolean templated;

    NotificationPayload payload;
}
