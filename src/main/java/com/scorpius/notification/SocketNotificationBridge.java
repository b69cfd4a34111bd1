package com.scorpius.notification;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorpius.domain.enums.NotificationPriority;
import com.scorpius.domain.enums.NotificationType;
import com.scorpius.domain.model.NotificationMetadata;
import com.scorpius.domain.model.NotificationPayload;
import com.scorpius.socket.SocketManager;
import com.scorpius.socket.Subscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns server push frames into notifications.
 *
 * <p>Subscribes to the alert-bearing frame types of the {@link SocketManager} and re-enters
 * the {@link NotificationDispatcher} with a payload routed by the preferences' per-type
 * channels:
 * <ul>
 *   <li>{@code threat_detected}: VULNERABILITY_FOUND, priority from {@code severity}</li>
 *   <li>{@code mev_opportunity}: MEV_OPPORTUNITY, HIGH</li>
 *   <li>{@code scan_complete}: SCAN_COMPLETED, NORMAL</li>
 *   <li>{@code mempool_alert}: THRESHOLD_BREACH, HIGH</li>
 *   <li>{@code system_update}: SYSTEM_ALERT, priority from {@code priority}</li>
 * </ul>
 */
@Component
public class SocketNotificationBridge {

    private static final Logger log = LoggerFactory.getLogger(SocketNotificationBridge.class);

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

    private final SocketManager socketManager;
    private final NotificationDispatcher notificationDispatcher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final List<Subscription> subscriptions = new ArrayList<>();

    public SocketNotificationBridge(
            SocketManager socketManager,
            NotificationDispatcher notificationDispatcher,
            ObjectMapper objectMapper,
            Clock clock) {
        this.socketManager = socketManager;
        this.notificationDispatcher = notificationDispatcher;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void subscribe() {
        subscriptions.add(socketManager.on("threat_detected", data -> forward(
                NotificationType.VULNERABILITY_FOUND, "Vulnerability Detected", priorityOf(data, "severity",
                        NotificationPriority.HIGH), data)));
        subscriptions.add(socketManager.on("mev_opportunity", data -> forward(
                NotificationType.MEV_OPPORTUNITY, "MEV Opportunity", NotificationPriority.HIGH, data)));
        subscriptions.add(socketManager.on("scan_complete", data -> forward(
                NotificationType.SCAN_COMPLETED, "Scan Completed", NotificationPriority.NORMAL, data)));
        subscriptions.add(socketManager.on("mempool_alert", data -> forward(
                NotificationType.THRESHOLD_BREACH, "Mempool Alert", NotificationPriority.HIGH, data)));
        subscriptions.add(socketManager.on("system_update", data -> forward(
                NotificationType.SYSTEM_ALERT, "System Alert", priorityOf(data, "priority",
                        NotificationPriority.NORMAL), data)));
        log.info("Socket notification bridge subscribed to {} frame types", subscriptions.size());
    }

    @PreDestroy
    public void unsubscribe() {
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
    }

    private void forward(NotificationType type, String defaultTitle, NotificationPriority priority, JsonNode data) {
        Map<String, Object> fields = data != null && data.isObject() ? objectMapper.convertValue(data, DATA_TYPE) : Map.of();
        NotificationPayload payload = NotificationPayload.builder()
                .type(type)
                .title(text(data, "title", defaultTitle))
                .message(text(data, "message", text(data, "description", defaultTitle)))
                .priority(priority)
                .channels(notificationDispatcher.getPreferences().channelsFor(type))
                .data(fields)
                .timestamp(clock.instant())
                .metadata(NotificationMetadata.builder()
                        .scanId(text(data, "scanId", null))
                        .contractAddress(text(data, "contractAddress", null))
                        .transactionHash(text(data, "transactionHash", null))
                        .source("websocket")
                        .build())
                .build();
        if (!notificationDispatcher.send(payload)) {
            log.debug("Socket notification {} not dispatched", payload.getId());
        }
    }

    private static NotificationPriority priorityOf(JsonNode data, String field, NotificationPriority fallback) {
        String value = text(data, field, null);
        if (value == null) {
            return fallback;
        }
        try {
            return NotificationPriority.fromValue(value);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    private static String text(JsonNode data, String field, String fallback) {
        if (data == null || !data.hasNonNull(field)) {
            return fallback;
        }
        return data.get(field).asText();
    }
}
