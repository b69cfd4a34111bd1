package com.scorpius.auth;

import com.scorpius.api.dto.request.LoginRequest;
import com.scorpius.api.dto.response.LoginResponse;
import com.scorpius.config.ClientConfig;
import com.scorpius.domain.model.User;
import com.scorpius.event.AuthEventType;
import com.scorpius.event.EventPublisherHelper;
import com.scorpius.exception.AuthException;
import com.scorpius.exception.ErrorCode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Owns the authenticated session of the process: login, token refresh, logout.
 *
 * <p>Refresh is single-flight. The first caller that needs a refresh installs a
 * {@link CompletableFuture} in {@link #inFlightRefresh} and performs the network call;
 * every concurrent caller joins that same future instead of issuing its own request.
 * A caller that arrives after the refresh finished sees the new pair directly.
 *
 * <p>When a refresh fails the session is cleared and a LOGGED_OUT {@link
 * com.scorpius.event.AuthEvent} is published; {@link #ensureValidToken()} then returns null
 * rather than throwing, so background consumers degrade to anonymous.
 *
 * <p>After each login or refresh a proactive refresh is scheduled at
 * {@code expiresAt - refreshThreshold}. The handle is cancelled on logout.
 */
@Service
public class AuthCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AuthCoordinator.class);

    private final AuthClient authClient;
    private final TokenStore tokenStore;
    private final JwtExpiryReader jwtExpiryReader;
    private final EventPublisherHelper eventPublisherHelper;
    private final TaskScheduler taskScheduler;
    private final ClientConfig clientConfig;
    private final Clock clock;

    private final AtomicReference<AuthState> state = new AtomicReference<>(AuthState.ANONYMOUS);

    /** Single-flight gate: non-null while a refresh call is in progress. */
    private final AtomicReference<CompletableFuture<TokenPair>> inFlightRefresh = new AtomicReference<>();

    private volatile User currentUser;
    private volatile ScheduledFuture<?> proactiveRefresh;

    public AuthCoordinator(
            AuthClient authClient,
            TokenStore tokenStore,
            JwtExpiryReader jwtExpiryReader,
            EventPublisherHelper eventPublisherHelper,
            TaskScheduler taskScheduler,
            ClientConfig clientConfig,
            Clock clock) {
        this.authClient = authClient;
        this.tokenStore = tokenStore;
        this.jwtExpiryReader = jwtExpiryReader;
        this.eventPublisherHelper = eventPublisherHelper;
        this.taskScheduler = taskScheduler;
        this.clientConfig = clientConfig;
        this.clock = clock;
    }

    /**
     * Exchanges credentials for a token pair and stores it.
     *
     * @throws AuthException INVALID_CREDENTIALS when the backend rejects the credentials,
     *     NETWORK_ERROR when it cannot be reached
     */
    public LoginResponse login(LoginRequest credentials) {
        AuthState previous = state.getAndSet(AuthState.AUTHENTICATING);
        LoginResponse response;
        try {
            response = authClient.login(credentials);
        } catch (RuntimeException e) {
            state.set(previous.hasSession() && tokenStore.hasTokens() ? previous : AuthState.ANONYMOUS);
            log.warn("Login failed for user {}: {}", credentials.getUsername(), e.getMessage());
            throw e;
        }
        if (response == null || response.getAccessToken() == null) {
            state.set(AuthState.ANONYMOUS);
            throw AuthException.invalidCredentials("Login response did not contain an access token");
        }

        TokenPair pair = toTokenPair(response, null);
        tokenStore.store(pair);
        currentUser = response.getUser();
        transition(AuthState.AUTHENTICATED, AuthEventType.LOGGED_IN, "Login successful");
        scheduleProactiveRefresh(pair);

        log.info(
                "Login successful for user: {}, token expires at {}",
                response.getUser() != null ? response.getUser().getUsername() : credentials.getUsername(),
                pair.getExpiresAt());
        return response;
    }

    /**
     * Returns an access token with at least {@code refreshThreshold} lifetime left,
     * refreshing first when needed. Returns null when there is no session or the refresh
     * failed (in which case the session has been cleared).
     */
    public String ensureValidToken() {
        TokenPair current = tokenStore.get();
        if (current == null) {
            return null;
        }
        if (!needsRefresh(current, clock.instant())) {
            return current.getAccessToken();
        }
        try {
            return refreshSingleFlight(current.getAccessToken()).join().getAccessToken();
        } catch (CompletionException e) {
            log.debug("No valid access token after refresh failure: {}", e.getCause().getMessage());
            return null;
        }
    }

    /**
     * Forces a refresh, joining one already in flight.
     */
    public CompletableFuture<TokenPair> refreshToken() {
        return refreshSingleFlight(null);
    }

    /**
     * Refreshes after the backend rejected {@code rejectedAccessToken}. When another caller
     * has already replaced that token the current pair is returned without a network call.
     */
    public CompletableFuture<TokenPair> refreshToken(String rejectedAccessToken) {
        return refreshSingleFlight(rejectedAccessToken);
    }

    /**
     * Best-effort remote logout followed by an unconditional local clear.
     */
    public void logout() {
        cancelProactiveRefresh();
        String accessToken = tokenStore.getAccessToken();
        if (accessToken != null) {
            try {
                authClient.logout(accessToken);
                log.info("Session invalidated on the backend");
            } catch (RuntimeException e) {
                log.warn("Logout request failed, clearing local session anyway: {}", e.getMessage());
            }
        }
        clearSession("User logged out");
    }

    /**
     * Clears the local session without contacting the backend. Used when a request was
     * rejected with 401 and no refresh could recover it.
     */
    public void invalidateSession(String reason) {
        log.warn("Session invalidated: {}", reason);
        clearSession(reason);
    }

    /**
     * Fetches the current user, refreshing the token once if the backend rejects it.
     */
    public User getCurrentUser() {
        String accessToken = ensureValidToken();
        if (accessToken == null) {
            throw AuthException.tokenExpired("No access token available");
        }
        try {
            currentUser = authClient.currentUser(accessToken);
            return currentUser;
        } catch (AuthException e) {
            if (e.getErrorCode() != ErrorCode.TOKEN_EXPIRED) {
                throw e;
            }
            log.debug("Access token rejected by /auth/me, refreshing once");
        }

        TokenPair refreshed;
        try {
            refreshed = refreshToken(accessToken).join();
        } catch (CompletionException e) {
            throw AuthException.tokenExpired("Session expired: " + e.getCause().getMessage());
        }
        currentUser = authClient.currentUser(refreshed.getAccessToken());
        return currentUser;
    }

    public String getAccessToken() {
        return tokenStore.getAccessToken();
    }

    public AuthState getState() {
        return state.get();
    }

    public boolean isAuthenticated() {
        return tokenStore.hasTokens() && state.get().hasSession();
    }

    /** Last user returned by login or /auth/me, without a network call. */
    public User getCachedUser() {
        return currentUser;
    }

    /** Visible for testing: the pending proactive refresh, or null. */
    public ScheduledFuture<?> getProactiveRefresh() {
        return proactiveRefresh;
    }

    /** Visible for testing: whether a refresh call is currently in flight. */
    public boolean isRefreshInFlight() {
        return inFlightRefresh.get() != null;
    }

    boolean needsRefresh(TokenPair pair, Instant now) {
        return pair.expiresWithin(clientConfig.getAuth().getRefreshThreshold(), now);
    }

    private CompletableFuture<TokenPair> refreshSingleFlight(String staleAccessToken) {
        CompletableFuture<TokenPair> created = new CompletableFuture<>();
        CompletableFuture<TokenPair> existing = inFlightRefresh.compareAndExchange(null, created);
        if (existing != null) {
            log.debug("Refresh already in progress, joining it");
            return existing;
        }
        try {
            created.complete(doRefresh(staleAccessToken));
        } catch (RuntimeException e) {
            created.completeExceptionally(e);
        } finally {
            inFlightRefresh.compareAndSet(created, null);
        }
        return created;
    }

    private TokenPair doRefresh(String staleAccessToken) {
        TokenPair current = tokenStore.get();
        if (current == null || current.getRefreshToken() == null) {
            throw AuthException.tokenExpired("No refresh token available");
        }
        if (staleAccessToken != null
                && !staleAccessToken.equals(current.getAccessToken())
                && !needsRefresh(current, clock.instant())) {
            log.debug("Token already refreshed by another caller");
            return current;
        }

        AuthState previous = state.getAndSet(AuthState.REFRESHING);
        try {
            LoginResponse response = authClient.refresh(current.getRefreshToken());
            if (response == null || response.getAccessToken() == null) {
                throw AuthException.tokenExpired("Refresh response did not contain an access token");
            }
            TokenPair refreshed = toTokenPair(response, current.getRefreshToken());
            tokenStore.store(refreshed);
            if (response.getUser() != null) {
                currentUser = response.getUser();
            }
            transition(AuthState.AUTHENTICATED, AuthEventType.TOKEN_REFRESHED, "Token refreshed");
            scheduleProactiveRefresh(refreshed);
            log.debug("Token refreshed, expires at {}", refreshed.getExpiresAt());
            return refreshed;
        } catch (RuntimeException e) {
            log.error("Token refresh failed: {}", e.getMessage());
            eventPublisherHelper.publishAuth(
                    this, AuthEventType.REFRESH_FAILED, previous, AuthState.REFRESHING, e.getMessage());
            clearSession("Token refresh failed");
            throw e;
        }
    }

    private TokenPair toTokenPair(LoginResponse response, String previousRefreshToken) {
        String refreshToken = response.getRefreshToken() != null ? response.getRefreshToken() : previousRefreshToken;
        Instant expiresAt = response.getExpiresIn() != null
                ? clock.instant().plusSeconds(response.getExpiresIn())
                : jwtExpiryReader.readExpiry(response.getAccessToken()).orElse(null);
        return new TokenPair(response.getAccessToken(), refreshToken, expiresAt);
    }

    private void scheduleProactiveRefresh(TokenPair pair) {
        cancelProactiveRefresh();
        if (!clientConfig.getAuth().isProactiveRefresh() || pair.getExpiresAt() == null) {
            return;
        }
        Instant now = clock.instant();
        Instant at = pair.getExpiresAt().minus(clientConfig.getAuth().getRefreshThreshold());
        if (at.isBefore(now)) {
            at = now;
        }
        proactiveRefresh = taskScheduler.schedule(this::runProactiveRefresh, at);
        log.debug("Proactive refresh scheduled in {}", Duration.between(now, at));
    }

    private void runProactiveRefresh() {
        if (!tokenStore.hasTokens()) {
            return;
        }
        log.debug("Running proactive token refresh");
        refreshToken().whenComplete((pair, error) -> {
            if (error != null) {
                log.warn("Proactive token refresh failed: {}", error.getMessage());
            }
        });
    }

    private void cancelProactiveRefresh() {
        ScheduledFuture<?> pending = proactiveRefresh;
        if (pending != null) {
            pending.cancel(false);
            proactiveRefresh = null;
        }
    }

    private void clearSession(String reason) {
        cancelProactiveRefresh();
        tokenStore.clear();
        currentUser = null;
        transition(AuthState.ANONYMOUS, AuthEventType.LOGGED_OUT, reason);
        log.info("Local session cleared: {}", reason);
    }

    private void transition(AuthState newState, AuthEventType eventType, String reason) {
        AuthState previous = state.getAndSet(newState);
        eventPublisherHelper.publishAuth(this, eventType, previous, newState, reason);
    }
}
