package com.scorpius.domain.model;

import lombok.Value;

/**
 * Per-channel delivery budget. Hourly and daily windows are checked independently
 * and both must allow a send.
 */
@Value(staticConstructor = "of")
public class RateLimit {

    int maxPerHour;
    int maxPerDay;
}
