package com.scorpius.event;

import com.scorpius.auth.AuthState;
import com.scorpius.domain.model.InAppNotification;
import com.scorpius.notification.InAppNotificationEvent;
import com.scorpius.socket.ConnectionState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed
 * factory methods for the connectivity and notification events.
 *
 * <p>All methods are non-blocking from the caller's point of view unless a listener is
 * a synchronous {@code @EventListener}; listeners that do I/O should be {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Auth ----

    public void publishAuth(
            Object source, AuthEventType eventType, AuthState previousState, AuthState newState, String reason) {
        applicationEventPublisher.publishEvent(new AuthEvent(source, eventType, previousState, newState, reason));
    }

    // ---- Socket ----

    public void publishSocket(
            Object source, SocketEventType eventType, ConnectionState state, int reconnectAttempts, String message) {
        applicationEventPublisher.publishEvent(
                new SocketEvent(source, eventType, state, reconnectAttempts, message));
    }

    // ---- In-app notification ----

    public void publishInAppNotification(Object source, InAppNotification notification) {
        applicationEventPublisher.publishEvent(new InAppNotificationEvent(source, notification));
    }
}
