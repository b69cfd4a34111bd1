package com.scorpius.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery targets for notifications. Each channel has its own enable flag,
 * credentials and optional rate limit in the notification preferences.
 */
public enum NotificationChannel {
    IN_APP("in_app"),
    EMAIL("email"),
    SLACK("slack"),
    TELEGRAM("telegram"),
    DISCORD("discord"),
    WEBHOOK("webhook"),
    SMS("sms"),
    PUSH("push");

    private final String value;

    NotificationChannel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NotificationChannel fromValue(String value) {
        for (NotificationChannel channel : values()) {
            if (channel.value.equalsIgnoreCase(value) || channel.name().equalsIgnoreCase(value)) {
                return channel;
            }
        }
        throw new IllegalArgumentException("Unknown notification channel: " + value);
    }
}
