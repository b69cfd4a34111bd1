package com.scorpius.domain.enums;

/**
 * Visual level of an in-app toast, derived from the notification priority.
 */
public enum ToastLevel {
    ERROR,
    WARNING,
    SUCCESS,
    INFO;

    public static ToastLevel forPriority(NotificationPriority priority) {
        return switch (priority) {
            case CRITICAL -> ERROR;
            case HIGH -> WARNING;
            case NORMAL -> SUCCESS;
            case LOW -> INFO;
        };
    }
}
