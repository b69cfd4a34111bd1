package com.scorpius.event;

import com.scorpius.auth.AuthState;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the authentication state of the process changes.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>SocketManager: disconnects on LOGGED_OUT, connects on LOGGED_IN when auto-connect is on</li>
 *   <li>UI bridge: redirects to the login screen on LOGGED_OUT</li>
 * </ul>
 */
public class AuthEvent extends ApplicationEvent {

    private final AuthEventType eventType;
    private final AuthState previousState;
    private final AuthState newState;
    private final String reason;
    private final Instant occurredAt;

    public AuthEvent(
            Object source, AuthEventType eventType, AuthState previousState, AuthState newState, String reason) {
        super(source);
        this.eventType = eventType;
        this.previousState = previousState;
        this.newState = newState;
        this.reason = reason;
        this.occurredAt = Instant.now();
    }

    public AuthEventType getEventType() {
        return eventType;
    }

    public AuthState getPreviousState() {
        return previousState;
    }

    public AuthState getNewState() {
        return newState;
    }

    public String getReason() {
        return reason;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
