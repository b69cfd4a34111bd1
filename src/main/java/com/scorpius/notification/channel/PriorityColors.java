package com.scorpius.notification.channel;

import com.scorpius.domain.enums.NotificationPriority;

/** Accent colors per priority, shared by Slack attachments and Discord embeds. */
final class PriorityColors {

    private PriorityColors() {}

    static String hex(NotificationPriority priority) {
        return switch (priority) {
            case CRITICAL -> "#dc2626";
            case HIGH -> "#ea580c";
            case NORMAL -> "#2563eb";
            case LOW -> "#16a34a";
        };
    }

    static int rgb(NotificationPriority priority) {
        return Integer.parseInt(hex(priority).substring(1), 16);
    }
}
