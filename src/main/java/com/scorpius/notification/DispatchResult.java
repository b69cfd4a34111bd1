package com.scorpius.notification;

import com.scorpius.domain.enums.NotificationChannel;
import java.util.Map;
import lombok.Value;

/**
 * Per-channel outcomes of one processed payload, reported to {@link NotificationMetrics}.
 */
@Value
public class DispatchResult {

    String payloadId;
    Map<NotificationChannel, ChannelOutcome> outcomes;

    public ChannelOutcome outcome(NotificationChannel channel) {
        return outcomes.get(channel);
    }

    public long deliveredCount() {
        return outcomes.values().stream()
                .filter(outcome -> outcome == ChannelOutcome.DELIVERED)
                .count();
    }
}
