package com.scorpius.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority of a notification. Declaration order is the filter scale:
 * {@code LOW < NORMAL < HIGH < CRITICAL}.
 *
 * <p>CRITICAL notifications bypass quiet hours.
 */
public enum NotificationPriority {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    NotificationPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(NotificationPriority other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static NotificationPriority fromValue(String value) {
        for (NotificationPriority priority : values()) {
            if (priority.value.equalsIgnoreCase(value) || priority.name().equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown notification priority: " + value);
    }
}
