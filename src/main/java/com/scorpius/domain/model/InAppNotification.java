package com.scorpius.domain.model;

import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import com.scorpius.domain.enums.ToastLevel;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An in-app toast as handed to the UI layer. CRITICAL toasts stay on screen longer.
 */
@Value
@Builder
public class InAppNotification {

    String id;
    NotificationType type;
    String title;
    String message;
    NotificationPriority priority;
    ToastLevel level;
    long durationMs;

    /** Also raise a native desktop notification when the UI has permission. */
    boolean showNative;

    Instant receivedAt;
}
