package com.scorpius.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of alerts produced by the platform. The type selects the default channel
 * routing and the per-channel message template.
 */
public enum NotificationType {
    VULNERABILITY_FOUND("vulnerability_found"),
    SCAN_COMPLETED("scan_completed"),
    MEV_OPPORTUNITY("mev_opportunity"),
    THRESHOLD_BREACH("threshold_breach"),
    SYSTEM_ALERT("system_alert"),
    TEAM_MESSAGE("team_message"),
    USER_ACTION("user_action"),
    SECURITY_WARNING("security_warning");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NotificationType fromValue(String value) {
        for (NotificationType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown notification type: " + value);
    }
}
