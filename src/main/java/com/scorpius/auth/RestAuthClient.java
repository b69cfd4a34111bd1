package com.scorpius.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorpius.api.dto.request.LoginRequest;
import com.scorpius.api.dto.request.RefreshTokenRequest;
import com.scorpius.api.dto.response.LoginResponse;
import com.scorpius.domain.model.User;
import com.scorpius.exception.AuthException;
import com.scorpius.exception.ErrorCode;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link AuthClient} over the backend REST API.
 *
 * <p>Uses its own {@link RestClient} without the bearer interceptor of the request
 * pipeline, so a refresh call can never trigger another refresh.
 */
@Component
public class RestAuthClient implements AuthClient {

    private static final Logger log = LoggerFactory.getLogger(RestAuthClient.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RestAuthClient(@Qualifier("authRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public LoginResponse login(LoginRequest credentials) {
        log.debug("Attempting login for user: {}", credentials.getUsername());
        try {
            return restClient
                    .post()
                    .uri("/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(credentials)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw toAuthException(response, ErrorCode.INVALID_CREDENTIALS, "Login failed");
                    })
                    .body(LoginResponse.class);
        } catch (RestClientException e) {
            throw transportFailure("Login", e);
        }
    }

    @Override
    public LoginResponse refresh(String refreshToken) {
        log.debug("Refreshing access token");
        try {
            return restClient
                    .post()
                    .uri("/auth/refresh")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new RefreshTokenRequest(refreshToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw toAuthException(response, ErrorCode.TOKEN_EXPIRED, "Token refresh failed");
                    })
                    .body(LoginResponse.class);
        } catch (RestClientException e) {
            throw transportFailure("Token refresh", e);
        }
    }

    @Override
    public void logout(String accessToken) {
        try {
            restClient
                    .post()
                    .uri("/auth/logout")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw toAuthException(response, ErrorCode.CLIENT_ERROR, "Logout failed");
                    })
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw transportFailure("Logout", e);
        }
    }

    @Override
    public User currentUser(String accessToken) {
        try {
            return restClient
                    .get()
                    .uri("/auth/me")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        ErrorCode code = response.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()
                                ? ErrorCode.TOKEN_EXPIRED
                                : ErrorCode.fromHttpStatus(response.getStatusCode().value());
                        throw toAuthException(response, code, "Failed to get current user");
                    })
                    .body(User.class);
        } catch (RestClientException e) {
            throw transportFailure("Current user", e);
        }
    }

    /**
     * Maps failures that carry no usable HTTP status: the backend was unreachable, or it
     * answered 2xx with a body that cannot be read.
     */
    private static AuthException transportFailure(String operation, RestClientException e) {
        String reason = e instanceof ResourceAccessException ? "request failed" : "response could not be read";
        return AuthException.network(operation + " " + reason + ": " + e.getClass().getSimpleName(), e);
    }

    private AuthException toAuthException(ClientHttpResponse response, ErrorCode clientErrorCode, String fallback)
            throws IOException {
        int status = response.getStatusCode().value();
        ErrorCode code = status >= 500 ? ErrorCode.SERVER_ERROR : clientErrorCode;
        return new AuthException(code, readMessage(response, fallback) + " (HTTP " + status + ")");
    }

    private String readMessage(ClientHttpResponse response, String fallback) {
        try {
            String message = objectMapper.readTree(response.getBody()).path("message").asText("");
            return message.isBlank() ? fallback : message;
        } catch (IOException e) {
            log.debug("Auth error body is not JSON: {}", e.getMessage());
            return fallback;
        }
    }
}
