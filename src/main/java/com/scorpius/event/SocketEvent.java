package com.scorpius.event;

import com.scorpius.socket.ConnectionState;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published on WebSocket connection lifecycle changes.
 *
 * <p>CONNECTION_LOST is the persistent "disconnected" indicator: it is published once the
 * reconnect budget is used up and the manager stops retrying on its own.
 */
public class SocketEvent extends ApplicationEvent {

    private final SocketEventType eventType;
    private final ConnectionState state;
    private final int reconnectAttempts;
    private final String message;
    private final Instant occurredAt;

    public SocketEvent(
            Object source, SocketEventType eventType, ConnectionState state, int reconnectAttempts, String message) {
        super(source);
        this.eventType = eventType;
        this.state = state;
        this.reconnectAttempts = reconnectAttempts;
        this.message = message;
        this.occurredAt = Instant.now();
    }

    public SocketEventType getEventType() {
        return eventType;
    }

    public ConnectionState getState() {
        return state;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
