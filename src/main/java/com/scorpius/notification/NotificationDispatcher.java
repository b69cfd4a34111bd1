package com.scorpius.notification;

import com.scorpius.domain.enums.NotificationChannel;
import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import com.scorpius.domain.model.ChannelConfig;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.domain.model.NotificationPreferences;
import com.scorpius.domain.model.RateLimit;
import com.scorpius.domain.model.RenderedNotification;
import com.scorpius.exception.RateLimitExceededException;
import com.scorpius.notification.channel.ChannelSender;
import com.scorpius.ratelimit.RateLimiter;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Central notification service that routes payloads to their delivery channels.
 *
 * <p>{@link #send(NotificationPayload)} applies the admission filters (quiet hours with a
 * CRITICAL bypass, minimum priority, keywords, expiry) and queues the payload. A single
 * drain loop on the drain executor takes payloads in FIFO order; the channels of one
 * payload are sent concurrently on the channel executor and awaited all-settled before
 * the next payload starts.
 *
 * <p>Each channel is checked against its hourly and daily budget in the {@link
 * RateLimiter} (keys {@code <channel>_<userId|global>_hour} and {@code _day}), rendered by
 * the {@link NotificationTemplateEngine} and handed to its {@link ChannelSender}. One
 * failing channel never affects the others, and {@code send()} never throws.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final NotificationPreferencesStore preferencesStore;
    private final NotificationFilter notificationFilter;
    private final NotificationTemplateEngine templateEngine;
    private final RateLimiter rateLimiter;
    private final NotificationMetrics notificationMetrics;
    private final Map<NotificationChannel, ChannelSender> senders;
    private final TaskExecutor drainExecutor;
    private final TaskExecutor channelExecutor;
    private final Clock clock;

    private final Queue<NotificationPayload> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);

    public NotificationDispatcher(
            NotificationPreferencesStore preferencesStore,
            NotificationFilter notificationFilter,
            NotificationTemplateEngine templateEngine,
            RateLimiter rateLimiter,
            NotificationMetrics notificationMetrics,
            List<ChannelSender> channelSenders,
            @Qualifier("notificationDrainExecutor") TaskExecutor drainExecutor,
            @Qualifier("notificationChannelExecutor") TaskExecutor channelExecutor,
            Clock clock) {
        this.preferencesStore = preferencesStore;
        this.notificationFilter = notificationFilter;
        this.templateEngine = templateEngine;
        this.rateLimiter = rateLimiter;
        this.notificationMetrics = notificationMetrics;
        this.senders = new EnumMap<>(NotificationChannel.class);
        for (ChannelSender sender : channelSenders) {
            this.senders.put(sender.channel(), sender);
        }
        this.drainExecutor = drainExecutor;
        this.channelExecutor = channelExecutor;
        this.clock = clock;
    }

    /**
     * Queues a payload for delivery.
     *
     * @return true when the payload passed the filters and was queued; delivery itself
     *     happens asynchronously and its per-channel outcome is not reflected here
     */
    public boolean send(NotificationPayload payload) {
        try {
            if (payload == null) {
                log.warn("Ignoring null notification payload");
                return false;
            }
            Optional<NotificationFilter.DropReason> dropReason =
                    notificationFilter.evaluate(payload, preferencesStore.get(), clock.instant());
            if (dropReason.isPresent()) {
                log.info("Notification {} dropped: {}", payload.getId(), dropReason.get().tag());
                notificationMetrics.recordDropped(dropReason.get());
                return false;
            }

            queue.offer(payload);
            notificationMetrics.recordDispatched();
            log.debug("Notification {} queued ({} pending)", payload.getId(), queue.size());
            scheduleDrain();
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to send notification: {}", e.getMessage(), e);
            return false;
        }
    }

    /**
     * Sends to the channels configured for {@code type} in the preferences.
     */
    public boolean send(NotificationType type, String title, String message, NotificationPriority priority) {
        return send(type, title, message, priority, Map.of());
    }

    public boolean send(
            NotificationType type,
            String title,
            String message,
            NotificationPriority priority,
            Map<String, Object> data) {
        NotificationPayload payload = NotificationPayload.builder()
                .type(type)
                .title(title)
                .message(message)
                .priority(priority != null ? priority : NotificationPriority.NORMAL)
                .channels(preferencesStore.get().channelsFor(type))
                .data(data != null ? data : Map.of())
                .timestamp(clock.instant())
                .build();
        return send(payload);
    }

    /**
     * Sends a SYSTEM_ALERT test notification to a single channel.
     */
    public boolean test(NotificationChannel channel) {
        NotificationPayload payload = NotificationPayload.builder()
                .id("test_" + clock.millis())
                .type(NotificationType.SYSTEM_ALERT)
                .title("Test Notification")
                .message("This is a test notification from Scorpius.")
                .priority(NotificationPriority.NORMAL)
                .channel(channel)
                .timestamp(clock.instant())
                .build();
        return send(payload);
    }

    public NotificationPreferences updatePreferences(UnaryOperator<NotificationPreferences> change) {
        return preferencesStore.update(change);
    }

    public NotificationPreferences getPreferences() {
        return preferencesStore.get();
    }

    /** Payloads accepted but not yet picked up by the drain loop. */
    public int getQueueSize() {
        return queue.size();
    }

    /** Visible for testing. */
    public boolean isProcessing() {
        return processing.get();
    }

    private void scheduleDrain() {
        if (!processing.compareAndSet(false, true)) {
            return;
        }
        try {
            drainExecutor.execute(this::drain);
        } catch (TaskRejectedException e) {
            processing.set(false);
            log.error("Notification drain rejected, {} payloads stay queued: {}", queue.size(), e.getMessage());
        }
    }

    private void drain() {
        do {
            NotificationPayload next;
            while ((next = queue.poll()) != null) {
                process(next);
            }
            processing.set(false);
            // a payload offered after the last poll but before the flag was cleared
        } while (!queue.isEmpty() && processing.compareAndSet(false, true));
    }

    private void process(NotificationPayload payload) {
        try {
            NotificationPreferences preferences = preferencesStore.get();
            Map<NotificationChannel, ChannelOutcome> outcomes = new LinkedHashMap<>();
            Map<NotificationChannel, CompletableFuture<ChannelOutcome>> pending = new LinkedHashMap<>();

            for (NotificationChannel channel : payload.getChannels()) {
                ChannelConfig config = preferences.channelConfig(channel);
                if (!config.isEnabled()) {
                    outcomes.put(channel, ChannelOutcome.DISABLED);
                    continue;
                }
                pending.put(
                        channel,
                        CompletableFuture.supplyAsync(() -> deliver(channel, config, payload), channelExecutor)
                                .exceptionally(error -> {
                                    log.error("Failed to send {} notification: {}", channel.getValue(), error.getMessage());
                                    return ChannelOutcome.FAILED;
                                }));
            }

            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();
            pending.forEach((channel, future) -> outcomes.put(channel, future.join()));

            DispatchResult result = new DispatchResult(payload.getId(), Map.copyOf(outcomes));
            notificationMetrics.recordResult(result);
            log.debug("Notification {} processed: {}", payload.getId(), outcomes);
        } catch (RuntimeException e) {
            log.error("Error processing notification {}: {}", payload.getId(), e.getMessage(), e);
        }
    }

    private ChannelOutcome deliver(NotificationChannel channel, ChannelConfig config, NotificationPayload payload) {
        try {
            acquireRateLimit(channel, config.getRateLimit(), payload);
        } catch (RateLimitExceededException e) {
            log.info("Rate limit exceeded for {}: {} ({})", channel.getValue(), payload.getId(), e.getMessage());
            return ChannelOutcome.RATE_LIMITED;
        }
        ChannelSender sender = senders.get(channel);
        if (sender == null) {
            log.warn("No sender registered for channel {}", channel.getValue());
            return ChannelOutcome.FAILED;
        }
        RenderedNotification rendered = templateEngine.render(payload, channel, config);
        return sender.send(config, rendered) ? ChannelOutcome.DELIVERED : ChannelOutcome.FAILED;
    }

    private void acquireRateLimit(NotificationChannel channel, RateLimit rateLimit, NotificationPayload payload) {
        if (rateLimit == null) {
            return;
        }
        String key = channel.getValue() + "_" + (payload.getUserId() != null ? payload.getUserId() : "global");
        rateLimiter.acquire(key + "_hour", rateLimit.getMaxPerHour(), HOUR);
        rateLimiter.acquire(key + "_day", rateLimit.getMaxPerDay(), DAY);
    }
}
