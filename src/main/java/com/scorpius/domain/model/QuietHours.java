package com.scorpius.domain.model;

import java.time.LocalTime;
import java.time.ZoneId;
import lombok.Builder;
import lombok.Value;

/**
 * Daily window during which only CRITICAL notifications are delivered.
 *
 * <p>The window is half-open, {@code [start, end)}, and wraps midnight when
 * {@code start} is after {@code end} (e.g. 22:00 to 08:00). Equal bounds mean an empty window.
 */
@Value
@Builder(toBuilder = true)
public class QuietHours {

    boolean enabled;

    @Builder.Default
    LocalTime start = LocalTime.of(22, 0);

    @Builder.Default
    LocalTime end = LocalTime.of(8, 0);

    @Builder.Default
    ZoneId timezone = ZoneId.systemDefault();

    public boolean contains(LocalTime time) {
        if (!enabled || start.equals(end)) {
            return false;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }
}
