package com.scorpius.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorpius.auth.AuthCoordinator;
import com.scorpius.config.ClientConfig;
import com.scorpius.event.AuthEvent;
import com.scorpius.event.EventPublisherHelper;
import com.scorpius.event.SocketEventType;
import com.scorpius.exception.AuthException;
import com.scorpius.exception.ProtocolException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Keeps at most one authenticated WebSocket open to the backend and fans incoming frames
 * out to per-type subscribers.
 *
 * <p>Reconnection: an unclean close (any code other than 1000, a transport error or a
 * connect timeout) increments the attempt counter and schedules a reconnect after
 * {@code min(reconnectInterval * 2^attempts, maxReconnectDelay)}, i.e. 2s, 4s, 8s... with
 * the defaults. A successful open resets the counter. Once {@code maxReconnectAttempts}
 * is reached the manager stops and publishes CONNECTION_LOST.
 *
 * <p>State is guarded by this object's monitor. Each connection attempt gets a generation
 * number; callbacks from an older generation (a session that was replaced or explicitly
 * closed) are ignored, so a late close can never trigger a second reconnect.
 *
 * <p>An {@code auth_required} frame closes the session and reconnects immediately with
 * the current token, bypassing the backoff.
 */
@Service
public class SocketManager {

    private static final Logger log = LoggerFactory.getLogger(SocketManager.class);

    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final WebSocketClient webSocketClient;
    private final AuthCoordinator authCoordinator;
    private final TaskScheduler taskScheduler;
    private final EventPublisherHelper eventPublisherHelper;
    private final ClientConfig clientConfig;
    private final ObjectMapper objectMapper;
    private final Counter reconnectCounter;

    private final Map<String, Set<SocketMessageHandler>> handlers = new ConcurrentHashMap<>();

    private ConnectionState state = ConnectionState.IDLE;
    private int reconnectAttempts;
    private long generation;
    private boolean connectionLost;
    private WebSocketSession session;
    private CompletableFuture<Void> connectFuture;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> connectTimeoutTask;

    public SocketManager(
            WebSocketClient webSocketClient,
            AuthCoordinator authCoordinator,
            TaskScheduler taskScheduler,
            EventPublisherHelper eventPublisherHelper,
            ClientConfig clientConfig,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.webSocketClient = webSocketClient;
        this.authCoordinator = authCoordinator;
        this.taskScheduler = taskScheduler;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clientConfig = clientConfig;
        this.objectMapper = objectMapper;
        this.reconnectCounter = Counter.builder("websocket.reconnects")
                .description("Reconnect attempts of the backend WebSocket")
                .register(meterRegistry);
    }

    // ---- Connection lifecycle ----

    /**
     * Opens the socket. Idempotent while CONNECTING or OPEN: the pending (or completed)
     * future of the current attempt is returned. A pending reconnect timer is cancelled
     * and the connection is attempted right away.
     */
    public CompletableFuture<Void> connect() {
        long attemptGeneration;
        CompletableFuture<Void> future;
        synchronized (this) {
            if (state == ConnectionState.CONNECTING || state == ConnectionState.OPEN) {
                return connectFuture;
            }
            cancelTask(reconnectTask);
            reconnectTask = null;
            if (connectionLost) {
                connectionLost = false;
                reconnectAttempts = 0;
            }
            attemptGeneration = beginConnecting();
            future = connectFuture;
        }
        dial(attemptGeneration);
        return future;
    }

    /**
     * Closes the socket with code 1000 and cancels any pending reconnect. Safe from any state.
     */
    public void disconnect() {
        WebSocketSession toClose;
        CompletableFuture<Void> pendingConnect;
        boolean wasActive;
        synchronized (this) {
            cancelTask(reconnectTask);
            cancelTask(connectTimeoutTask);
            reconnectTask = null;
            connectTimeoutTask = null;
            generation++;
            wasActive = state != ConnectionState.IDLE;
            toClose = session;
            session = null;
            pendingConnect = state == ConnectionState.CONNECTING ? connectFuture : null;
            reconnectAttempts = 0;
            state = toClose != null ? ConnectionState.CLOSING : ConnectionState.IDLE;
        }

        if (pendingConnect != null) {
            pendingConnect.cancel(false);
        }
        if (toClose != null) {
            try {
                toClose.close(CloseStatus.NORMAL.withReason("Client disconnect"));
            } catch (IOException e) {
                log.warn("Error closing WebSocket session: {}", e.getMessage());
            }
        }
        synchronized (this) {
            if (state == ConnectionState.CLOSING) {
                state = ConnectionState.IDLE;
            }
        }
        if (wasActive) {
            log.info("WebSocket disconnected by client");
            eventPublisherHelper.publishSocket(
                    this, SocketEventType.DISCONNECTED, ConnectionState.IDLE, 0, "Client disconnect");
        }
    }

    @EventListener
    public void onAuthEvent(AuthEvent event) {
        switch (event.getEventType()) {
            case LOGGED_OUT -> {
                log.info("Auth session ended ({}), closing WebSocket", event.getReason());
                disconnect();
            }
            case LOGGED_IN -> {
                ClientConfig.WebSocket config = clientConfig.getWebsocket();
                if (config.isEnabled() && config.isAutoConnect()) {
                    connect().whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.warn("WebSocket auto-connect failed: {}", error.getMessage());
                        }
                    });
                }
            }
            default -> {}
        }
    }

    // ---- Subscriptions ----

    /**
     * Subscribes {@code handler} to frames of {@code type}. Registering the same handler
     * twice for a type has no effect.
     */
    public Subscription on(String type, SocketMessageHandler handler) {
        handlers.computeIfAbsent(type, key -> new CopyOnWriteArraySet<>()).add(handler);
        return () -> off(type, handler);
    }

    public void off(String type) {
        handlers.remove(type);
    }

    public void off(String type, SocketMessageHandler handler) {
        handlers.computeIfPresent(type, (key, set) -> {
            set.remove(handler);
            return set.isEmpty() ? null : set;
        });
    }

    /** Visible for testing. */
    public int getHandlerCount(String type) {
        Set<SocketMessageHandler> set = handlers.get(type);
        return set != null ? set.size() : 0;
    }

    // ---- Outbound ----

    /**
     * Sends a frame. Does nothing (apart from a warning) unless the socket is OPEN.
     *
     * @return whether the frame was handed to the session
     */
    public boolean send(SocketMessage message) {
        WebSocketSession current;
        synchronized (this) {
            current = state == ConnectionState.OPEN ? session : null;
        }
        if (current == null) {
            log.warn("Cannot send {} message - WebSocket not connected", message.getType());
            return false;
        }
        try {
            current.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
            return true;
        } catch (IOException e) {
            log.warn("Failed to send {} message: {}", message.getType(), e.getMessage());
            return false;
        }
    }

    // ---- Inspection ----

    public synchronized SocketSession getSession() {
        return new SocketSession(clientConfig.getWebsocket().getBaseUrl(), state, reconnectAttempts);
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized boolean isConnected() {
        return state == ConnectionState.OPEN;
    }

    /** True after reconnect attempts ran out, until the next explicit connect. */
    public synchronized boolean isConnectionLost() {
        return connectionLost;
    }

    /** Visible for testing: the pending reconnect timer, or null. */
    public synchronized ScheduledFuture<?> getReconnectTask() {
        return reconnectTask;
    }

    /**
     * Delay before reconnect number {@code attempt} (1-based):
     * {@code min(reconnectInterval * 2^attempt, maxReconnectDelay)}.
     */
    public Duration computeReconnectDelay(int attempt) {
        ClientConfig.WebSocket config = clientConfig.getWebsocket();
        Duration delay = config.getReconnectInterval().multipliedBy(1L << Math.min(attempt, 20));
        return delay.compareTo(config.getMaxReconnectDelay()) > 0 ? config.getMaxReconnectDelay() : delay;
    }

    // ---- Internals ----

    private long beginConnecting() {
        generation++;
        state = ConnectionState.CONNECTING;
        connectFuture = new CompletableFuture<>();
        return generation;
    }

    private void dial(long attemptGeneration) {
        String token = authCoordinator.ensureValidToken();
        if (token == null) {
            abandonConnect(attemptGeneration, AuthException.tokenExpired("No access token for WebSocket connection"));
            return;
        }

        URI uri = UriComponentsBuilder.fromUriString(clientConfig.getWebsocket().getBaseUrl())
                .queryParam("token", token)
                .encode()
                .build()
                .toUri();
        log.debug("Connecting to WebSocket: {}", clientConfig.getWebsocket().getBaseUrl());

        CompletableFuture<WebSocketSession> handshake;
        try {
            handshake = webSocketClient.execute(
                    new GenerationHandler(attemptGeneration), new WebSocketHttpHeaders(), uri);
        } catch (RuntimeException e) {
            onConnectFailed(attemptGeneration, e);
            return;
        }

        Duration timeout = clientConfig.getWebsocket().getConnectTimeout();
        ScheduledFuture<?> timeoutTask = taskScheduler.schedule(
                () -> onConnectTimeout(attemptGeneration, handshake),
                taskScheduler.getClock().instant().plus(timeout));
        synchronized (this) {
            if (attemptGeneration == generation && state == ConnectionState.CONNECTING) {
                connectTimeoutTask = timeoutTask;
            } else {
                cancelTask(timeoutTask);
            }
        }

        handshake.whenComplete((established, error) -> {
            if (error != null) {
                onConnectFailed(attemptGeneration, error);
            }
        });
    }

    private void onOpen(long attemptGeneration, WebSocketSession rawSession) {
        CompletableFuture<Void> future;
        synchronized (this) {
            if (attemptGeneration != generation || state != ConnectionState.CONNECTING) {
                closeQuietly(rawSession);
                return;
            }
            cancelTask(connectTimeoutTask);
            connectTimeoutTask = null;
            session = new ConcurrentWebSocketSessionDecorator(
                    rawSession, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
            state = ConnectionState.OPEN;
            reconnectAttempts = 0;
            connectionLost = false;
            future = connectFuture;
        }
        log.info("WebSocket connected");
        eventPublisherHelper.publishSocket(this, SocketEventType.CONNECTED, ConnectionState.OPEN, 0, "Connected");
        future.complete(null);
    }

    private void onClosed(long attemptGeneration, CloseStatus status) {
        synchronized (this) {
            if (attemptGeneration != generation) {
                return;
            }
            session = null;
            cancelTask(connectTimeoutTask);
            connectTimeoutTask = null;
            if (state == ConnectionState.CLOSING || state == ConnectionState.IDLE) {
                state = ConnectionState.IDLE;
                return;
            }
            if (state == ConnectionState.RECONNECT_WAIT) {
                return;
            }
            if (state == ConnectionState.CONNECTING) {
                connectFuture.completeExceptionally(
                        new IllegalStateException("WebSocket closed during handshake: " + status));
            }
            if (CloseStatus.NORMAL.equalsCode(status)) {
                state = ConnectionState.IDLE;
            }
        }

        log.warn("WebSocket disconnected: {} {}", status.getCode(), status.getReason());
        if (CloseStatus.NORMAL.equalsCode(status)) {
            eventPublisherHelper.publishSocket(
                    this, SocketEventType.DISCONNECTED, ConnectionState.IDLE, 0, "Closed by server");
            return;
        }
        scheduleReconnect(attemptGeneration, "Unclean close " + status.getCode());
    }

    private void onConnectFailed(long attemptGeneration, Throwable error) {
        CompletableFuture<Void> future;
        synchronized (this) {
            if (attemptGeneration != generation || state != ConnectionState.CONNECTING) {
                return;
            }
            future = connectFuture;
        }
        log.error("WebSocket connection failed: {}", error.getMessage());
        future.completeExceptionally(error);
        scheduleReconnect(attemptGeneration, "Connect failed: " + error.getMessage());
    }

    private void onConnectTimeout(long attemptGeneration, CompletableFuture<WebSocketSession> handshake) {
        synchronized (this) {
            if (attemptGeneration != generation || state != ConnectionState.CONNECTING) {
                return;
            }
            connectTimeoutTask = null;
        }
        onConnectFailed(
                attemptGeneration,
                new IOException("WebSocket connection timeout after "
                        + clientConfig.getWebsocket().getConnectTimeout().toMillis() + "ms"));
        handshake.cancel(true);
    }

    private void abandonConnect(long attemptGeneration, RuntimeException reason) {
        CompletableFuture<Void> future;
        synchronized (this) {
            if (attemptGeneration != generation) {
                return;
            }
            state = ConnectionState.IDLE;
            future = connectFuture;
        }
        log.warn("WebSocket connect abandoned: {}", reason.getMessage());
        future.completeExceptionally(reason);
    }

    private void scheduleReconnect(long attemptGeneration, String reason) {
        int attempts;
        Duration delay;
        synchronized (this) {
            // only the first failure report of an attempt schedules a reconnect
            if (attemptGeneration != generation
                    || (state != ConnectionState.CONNECTING && state != ConnectionState.OPEN)) {
                return;
            }
            int maxAttempts = clientConfig.getWebsocket().getMaxReconnectAttempts();
            if (!clientConfig.getWebsocket().isEnabled() || reconnectAttempts >= maxAttempts) {
                state = ConnectionState.IDLE;
                connectionLost = true;
                attempts = reconnectAttempts;
                delay = null;
            } else {
                reconnectAttempts++;
                attempts = reconnectAttempts;
                delay = computeReconnectDelay(attempts);
                state = ConnectionState.RECONNECT_WAIT;
                reconnectTask = taskScheduler.schedule(
                        () -> reconnect(attemptGeneration), taskScheduler.getClock().instant().plus(delay));
            }
        }

        if (delay == null) {
            log.error("WebSocket failed to reconnect after {} attempts ({}). Giving up.", attempts, reason);
            eventPublisherHelper.publishSocket(
                    this, SocketEventType.CONNECTION_LOST, ConnectionState.IDLE, attempts, reason);
            return;
        }
        log.info(
                "Scheduling WebSocket reconnect in {}ms (attempt {}/{})",
                delay.toMillis(),
                attempts,
                clientConfig.getWebsocket().getMaxReconnectAttempts());
        eventPublisherHelper.publishSocket(
                this, SocketEventType.RECONNECT_SCHEDULED, ConnectionState.RECONNECT_WAIT, attempts, reason);
    }

    private void reconnect(long scheduledGeneration) {
        long attemptGeneration;
        synchronized (this) {
            if (scheduledGeneration != generation || state != ConnectionState.RECONNECT_WAIT) {
                return;
            }
            reconnectTask = null;
            attemptGeneration = beginConnecting();
        }
        reconnectCounter.increment();
        dial(attemptGeneration);
    }

    private void onFrame(long attemptGeneration, String text) {
        synchronized (this) {
            if (attemptGeneration != generation) {
                return;
            }
        }
        SocketMessage message;
        try {
            message = parse(text);
        } catch (ProtocolException e) {
            log.error("Failed to parse WebSocket message: {}", e.getMessage());
            return;
        }
        log.debug("Received WebSocket message: {}", message.getType());

        switch (message.getType()) {
            case SocketMessage.LIVE_UPDATE -> handleLiveUpdate(message.getPayload());
            case SocketMessage.AUTH_REQUIRED -> handleAuthRequired(attemptGeneration);
            case SocketMessage.ERROR -> {
                log.error("WebSocket server error: {}", message.getPayload());
                emit(SocketMessage.ERROR, message.getPayload());
            }
            default -> emit(message.getType(), message.getPayload());
        }
    }

    private SocketMessage parse(String text) {
        try {
            SocketMessage message = objectMapper.readValue(text, SocketMessage.class);
            if (message == null || message.getType() == null) {
                throw new ProtocolException("Frame has no type: " + abbreviate(text), null);
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame: " + abbreviate(text), e);
        }
    }

    private void handleLiveUpdate(JsonNode payload) {
        LiveUpdate update;
        try {
            update = objectMapper.treeToValue(payload, LiveUpdate.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Malformed live_update payload: {}", e.getMessage());
            return;
        }
        if (update == null) {
            log.error("live_update frame without payload");
            return;
        }
        if (update.getType() != null) {
            emit(update.getType(), update.getData());
        }
        emit(SocketMessage.LIVE_UPDATE, payload);
    }

    private void handleAuthRequired(long attemptGeneration) {
        WebSocketSession toClose;
        long nextGeneration;
        synchronized (this) {
            if (attemptGeneration != generation) {
                return;
            }
            toClose = session;
            session = null;
            nextGeneration = beginConnecting();
        }
        log.warn("WebSocket authentication required, reconnecting with current token");
        closeQuietly(toClose);
        dial(nextGeneration);
    }

    private void emit(String type, JsonNode data) {
        Set<SocketMessageHandler> subscribers = handlers.get(type);
        if (subscribers == null) {
            return;
        }
        for (SocketMessageHandler handler : subscribers) {
            try {
                handler.handle(data);
            } catch (RuntimeException e) {
                log.error("Error in WebSocket event handler for {}: {}", type, e.getMessage(), e);
            }
        }
    }

    private void closeQuietly(WebSocketSession target) {
        if (target == null) {
            return;
        }
        try {
            target.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("Error closing stale WebSocket session: {}", e.getMessage());
        }
    }

    private static void cancelTask(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    /**
     * Routes session callbacks to the manager, tagged with the generation of the attempt
     * that created the session.
     */
    private class GenerationHandler extends TextWebSocketHandler {

        private final long attemptGeneration;

        GenerationHandler(long attemptGeneration) {
            this.attemptGeneration = attemptGeneration;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession webSocketSession) {
            onOpen(attemptGeneration, webSocketSession);
        }

        @Override
        protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage message) {
            onFrame(attemptGeneration, message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
            log.warn("WebSocket transport error: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
            onClosed(attemptGeneration, status);
        }
    }
}
