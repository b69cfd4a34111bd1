package com.scorpius.notification;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for notification dispatch:
 * <ul>
 *   <li><b>notifications.dispatched</b>: payloads accepted and queued</li>
 *   <li><b>notifications.dropped</b> {reason}: payloads rejected by admission filters</li>
 *   <li><b>notifications.channel</b> {channel, outcome}: per-channel results, outcome one of
 *       delivered, failed, rate_limited, disabled</li>
 * </ul>
 */
@Component
public class NotificationMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter dispatchedCounter;

    public NotificationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.dispatchedCounter = Counter.builder("notifications.dispatched")
                .description("Notifications accepted for delivery")
                .register(meterRegistry);
    }

    public void recordDispatched() {
        dispatchedCounter.increment();
    }

    public void recordDropped(NotificationFilter.DropReason reason) {
        Counter.builder("notifications.dropped")
                .description("Notifications rejected before queueing")
                .tag("reason", reason.tag())
                .register(meterRegistry)
                .increment();
    }

    public void recordResult(DispatchResult result) {
        result.getOutcomes().forEach((channel, outcome) -> Counter.builder("notifications.channel")
                .description("Per-channel delivery outcomes")
                .tag("channel", channel.getValue())
                .tag("outcome", outcome.tag())
                .register(meterRegistry)
                .increment());
    }
}
