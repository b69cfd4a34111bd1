package com.scorpius.config;

import com.scorpius.api.TimeoutRequestFactory;
import java.time.Clock;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Configuration properties and bean definitions for the backend channel.
 *
 * <p>Binds to the {@code scorpius.*} prefix. Provides:
 * <ul>
 *   <li>A {@link RestClient} for the {@code /auth/*} endpoints. It carries no bearer
 *       interceptor so that a refresh can never recurse into itself.</li>
 *   <li>A {@link RestClient} for outbound channel webhooks (Slack, Discord, Telegram, ...).</li>
 *   <li>The {@link TimeoutRequestFactory} used by the request pipeline to build one
 *       request factory per effective read timeout.</li>
 *   <li>The {@link WebSocketClient} and the shared {@link Clock}.</li>
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "scorpius")
@Getter
@Setter
public class ClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

    private Api api = new Api();

    private Auth auth = new Auth();

    private WebSocket websocket = new WebSocket();

    @Bean
    public RestClient authRestClient() {
        log.info("Creating auth RestClient for {}", api.getBaseUrl());
        return RestClient.builder()
                .baseUrl(api.getBaseUrl())
                .requestFactory(timeoutRequestFactory().forTimeout(api.getTimeout()))
                .build();
    }

    /**
     * RestClient for third-party delivery endpoints. Absolute URLs only, no base URL.
     */
    @Bean
    public RestClient channelRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(api.getConnectTimeout());
        requestFactory.setReadTimeout(api.getTimeout());
        return RestClient.builder().requestFactory(requestFactory).build();
    }

    @Bean
    public TimeoutRequestFactory timeoutRequestFactory() {
        return readTimeout -> {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(api.getConnectTimeout());
            requestFactory.setReadTimeout(readTimeout);
            return requestFactory;
        };
    }

    @Bean
    public WebSocketClient webSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Getter
    @Setter
    public static class Api {

        /** Base URL of the backend REST API. Absolute request URLs bypass it. */
        private String baseUrl = "http://localhost:8000/api";

        /** Default read timeout for a single attempt. */
        private Duration timeout = Duration.ofSeconds(30);

        private Duration connectTimeout = Duration.ofSeconds(10);

        /** Retries after the first attempt, on network failure or 5xx only. */
        private int retries = 3;

        /** Base of the exponential backoff: delay = 2^attempt * backoffBase. */
        private Duration backoffBase = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Auth {

        /** Refresh the access token when less than this much lifetime remains. */
        private Duration refreshThreshold = Duration.ofMinutes(5);

        /** Schedule a refresh ahead of expiry instead of waiting for the next request. */
        private boolean proactiveRefresh = true;
    }

    @Getter
    @Setter
    public static class WebSocket {

        private boolean enabled = true;

        /** WebSocket endpoint; the access token is appended as the {@code token} query parameter. */
        private String baseUrl = "ws://localhost:8000/ws";

        /** Base reconnect delay; the n-th retry waits base * 2^n. */
        private Duration reconnectInterval = Duration.ofSeconds(1);

        private Duration maxReconnectDelay = Duration.ofSeconds(30);

        private int maxReconnectAttempts = 10;

        private Duration connectTimeout = Duration.ofSeconds(10);

        /** Connect automatically after a successful login. */
        private boolean autoConnect = true;
    }
}
