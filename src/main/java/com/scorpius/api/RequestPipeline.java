package com.scorpius.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorpius.api.dto.response.ApiResponse;
import com.scorpius.auth.AuthCoordinator;
import com.scorpius.auth.TokenPair;
import com.scorpius.config.ClientConfig;
import com.scorpius.exception.ApiException;
import com.scorpius.exception.ErrorCode;
import com.scorpius.exception.NetworkException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Single entry point for backend REST calls.
 *
 * <p>Each call runs through, in order:
 * <ol>
 *   <li>request interceptors ({@link BearerTokenInterceptor} plus any other
 *       {@link ClientHttpRequestInterceptor} bean),</li>
 *   <li>a read timeout on the request factory (default {@code scorpius.api.timeout}),</li>
 *   <li>a Resilience4j retry: network failures and 5xx are retried with a backoff of
 *       {@code 2^attempt * backoffBase}, for {@code retries + 1} attempts in total.
 *       4xx responses are never retried.</li>
 * </ol>
 *
 * <p>A 401 gets exactly one transparent replay after a successful token refresh. If the
 * replay is rejected too, or the refresh fails, the session is invalidated and the call
 * fails with UNAUTHORIZED. Every terminal failure is an {@link ApiException}; transport
 * exceptions never reach callers.
 */
@Service
public class RequestPipeline {

    private static final Logger log = LoggerFactory.getLogger(RequestPipeline.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final ClientConfig clientConfig;
    private final AuthCoordinator authCoordinator;
    private final TimeoutRequestFactory timeoutRequestFactory;
    private final List<ClientHttpRequestInterceptor> interceptors;
    private final ObjectMapper objectMapper;

    private final Map<Duration, RestClient> clientsByTimeout = new ConcurrentHashMap<>();

    public RequestPipeline(
            ClientConfig clientConfig,
            AuthCoordinator authCoordinator,
            TimeoutRequestFactory timeoutRequestFactory,
            List<ClientHttpRequestInterceptor> interceptors,
            ObjectMapper objectMapper) {
        this.clientConfig = clientConfig;
        this.authCoordinator = authCoordinator;
        this.timeoutRequestFactory = timeoutRequestFactory;
        this.interceptors = List.copyOf(interceptors);
        this.objectMapper = objectMapper;
    }

    public <T> ApiResponse<T> request(String endpoint, RequestOptions options, Class<T> responseType) {
        return request(endpoint, options, objectMapper.constructType(responseType));
    }

    public <T> ApiResponse<T> request(String endpoint, RequestOptions options, JavaType responseType) {
        PendingRequest pending = resolve(endpoint, options);
        RawResponse response = executeWithRetry(pending);

        if (response.status() == 401) {
            response = replayAfterRefresh(pending, response);
        }
        if (response.status() < 200 || response.status() >= 300) {
            throw toApiException(pending, response);
        }
        return toApiResponse(pending, response, responseType);
    }

    public <T> ApiResponse<T> get(String endpoint, Class<T> responseType) {
        return request(endpoint, RequestOptions.of(HttpMethod.GET), responseType);
    }

    public <T> ApiResponse<T> post(String endpoint, Object body, Class<T> responseType) {
        return request(endpoint, RequestOptions.of(HttpMethod.POST, body), responseType);
    }

    public <T> ApiResponse<T> put(String endpoint, Object body, Class<T> responseType) {
        return request(endpoint, RequestOptions.of(HttpMethod.PUT, body), responseType);
    }

    public <T> ApiResponse<T> patch(String endpoint, Object body, Class<T> responseType) {
        return request(endpoint, RequestOptions.of(HttpMethod.PATCH, body), responseType);
    }

    public <T> ApiResponse<T> delete(String endpoint, Class<T> responseType) {
        return request(endpoint, RequestOptions.of(HttpMethod.DELETE), responseType);
    }

    /**
     * Backoff before retry number {@code attempt + 1}: {@code 2^attempt * backoffBase}.
     * Visible for testing.
     */
    public Duration computeBackoffDelay(int attempt) {
        return clientConfig.getApi().getBackoffBase().multipliedBy(1L << Math.min(attempt, 20));
    }

    private RawResponse replayAfterRefresh(PendingRequest pending, RawResponse rejected) {
        if (authCoordinator.getAccessToken() == null) {
            log.debug("401 from {} without a session", pending.getEndpoint());
            return rejected;
        }
        log.warn("Received 401 from {}, refreshing token and replaying once", pending.getEndpoint());
        TokenPair refreshed;
        try {
            refreshed = authCoordinator.refreshToken(rejected.bearerToken()).join();
        } catch (CompletionException e) {
            // refresh failure has already cleared the session and published LOGGED_OUT
            log.warn("Token refresh after 401 failed: {}", e.getCause().getMessage());
            return rejected;
        }

        RawResponse replayed = executeWithRetry(pending);
        if (replayed.status() == 401) {
            log.warn("Replay of {} rejected with refreshed token {}", pending.getEndpoint(), refreshed);
            authCoordinator.invalidateSession("Request to " + pending.getEndpoint() + " rejected after refresh");
        }
        return replayed;
    }

    private RawResponse executeWithRetry(PendingRequest pending) {
        RetryConfig config = RetryConfig.<RawResponse>custom()
                .maxAttempts(pending.getRetries() + 1)
                .intervalFunction(attempt -> computeBackoffDelay(attempt - 1).toMillis())
                .retryOnResult(response -> response.status() >= 500)
                .retryExceptions(NetworkException.class)
                .failAfterMaxAttempts(false)
                .build();
        Retry retry = Retry.of("api-" + pending.getMethod().name(), config);
        retry.getEventPublisher()
                .onRetry(event -> log.warn(
                        "Request {} {} failed, retrying in {}ms (attempt {}/{})",
                        pending.getMethod(),
                        pending.getEndpoint(),
                        event.getWaitInterval().toMillis(),
                        event.getNumberOfRetryAttempts() + 1,
                        pending.getRetries() + 1));

        return Retry.decorateSupplier(retry, () -> exchange(pending)).get();
    }

    private RawResponse exchange(PendingRequest pending) {
        RestClient client = clientsByTimeout.computeIfAbsent(pending.getTimeout(), this::buildClient);
        try {
            RestClient.RequestBodySpec spec = client.method(pending.getMethod())
                    .uri(pending.getUrl())
                    .headers(headers -> pending.getHeaders().forEach(headers::set));
            if (pending.getBody() != null) {
                spec.contentType(MediaType.APPLICATION_JSON).body(pending.getBody());
            }
            return spec.exchange((request, response) -> new RawResponse(
                    response.getStatusCode().value(),
                    StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8),
                    request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION)));
        } catch (ResourceAccessException e) {
            Map<String, Object> details = Map.of("endpoint", pending.getEndpoint());
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new NetworkException(
                        ErrorCode.TIMEOUT,
                        "Request timeout after " + pending.getTimeout().toMillis() + "ms",
                        details,
                        e);
            }
            throw new NetworkException(ErrorCode.NETWORK_ERROR, "Network request failed: " + e.getMessage(), details, e);
        }
    }

    private RestClient buildClient(Duration timeout) {
        return RestClient.builder()
                .requestFactory(timeoutRequestFactory.forTimeout(timeout))
                .requestInterceptors(list -> list.addAll(interceptors))
                .build();
    }

    private PendingRequest resolve(String endpoint, RequestOptions options) {
        RequestOptions effective = options != null ? options : RequestOptions.of(HttpMethod.GET);
        ClientConfig.Api api = clientConfig.getApi();
        return new PendingRequest(
                endpoint,
                resolveUrl(endpoint, api.getBaseUrl()),
                effective.getMethod(),
                effective.getHeaders(),
                effective.getBody(),
                effective.getRetries() != null ? effective.getRetries() : api.getRetries(),
                effective.getTimeout() != null ? effective.getTimeout() : api.getTimeout());
    }

    static URI resolveUrl(String endpoint, String baseUrl) {
        if (endpoint.startsWith("http://") || endpoint.startsWith("https://")) {
            return URI.create(endpoint);
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return URI.create(endpoint.startsWith("/") ? base + endpoint : base + "/" + endpoint);
    }

    private <T> ApiResponse<T> toApiResponse(PendingRequest pending, RawResponse response, JavaType responseType) {
        if (response.body().isBlank()) {
            return ApiResponse.of(true, null, null, null, response.status());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            if (responseType.hasRawClass(String.class)) {
                return ApiResponse.of(true, objectMapper.convertValue(response.body(), responseType), null, null,
                        response.status());
            }
            throw new ApiException(
                    ErrorCode.PROTOCOL_ERROR,
                    "Malformed response body from " + pending.getEndpoint(),
                    Map.of("endpoint", pending.getEndpoint(), "status", response.status()),
                    e);
        }

        try {
            if (isEnvelope(root)) {
                T data = objectMapper.convertValue(root.get("data"), responseType);
                return ApiResponse.of(
                        root.path("success").asBoolean(true),
                        data,
                        root.hasNonNull("message") ? root.get("message").asText() : null,
                        parseTimestamp(root.path("timestamp").asText(null)),
                        response.status());
            }
            return ApiResponse.of(true, objectMapper.convertValue(root, responseType), null, null, response.status());
        } catch (IllegalArgumentException e) {
            throw new ApiException(
                    ErrorCode.PROTOCOL_ERROR,
                    "Unexpected response shape from " + pending.getEndpoint() + ": " + e.getMessage(),
                    Map.of("endpoint", pending.getEndpoint(), "status", response.status()),
                    e);
        }
    }

    private ApiException toApiException(PendingRequest pending, RawResponse response) {
        ErrorCode code = ErrorCode.fromHttpStatus(response.status());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", response.status());
        details.put("endpoint", pending.getEndpoint());
        if (!response.body().isBlank()) {
            details.put("body", response.body());
        }
        log.error("Request {} {} failed with HTTP {}", pending.getMethod(), pending.getEndpoint(), response.status());
        return new ApiException(code, errorMessage(response), details);
    }

    private String errorMessage(RawResponse response) {
        String fallback = "HTTP " + response.status();
        if (response.body().isBlank()) {
            return fallback;
        }
        try {
            String message = objectMapper.readTree(response.body()).path("message").asText("");
            return message.isBlank() ? fallback : message;
        } catch (JsonProcessingException e) {
            return fallback;
        }
    }

    private static boolean isEnvelope(JsonNode root) {
        return root.isObject() && root.has("success") && root.has("data");
    }

    private static Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private record RawResponse(int status, String body, String authorization) {

        String bearerToken() {
            return authorization != null && authorization.startsWith(BEARER_PREFIX)
                    ? authorization.substring(BEARER_PREFIX.length())
                    : null;
        }
    }
}
