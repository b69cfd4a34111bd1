package com.scorpius.notification;

import java.util.Locale;

/** Result of one channel for one payload. */
public enum ChannelOutcome {
    DELIVERED,
    FAILED,
    RATE_LIMITED,
    DISABLED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
