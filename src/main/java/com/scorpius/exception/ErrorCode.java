package com.scorpius.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", false),
    UNAUTHORIZED("UNAUTHORIZED", false),
    FORBIDDEN("FORBIDDEN", false),
    NOT_FOUND("NOT_FOUND", false),
    CLIENT_ERROR("CLIENT_ERROR", false),
    INVALID_CREDENTIALS("INVALID_CREDENTIALS", false),
    TOKEN_EXPIRED("TOKEN_EXPIRED", false),
    NETWORK_ERROR("NETWORK_ERROR", true),
    TIMEOUT("TIMEOUT", true),
    SERVER_ERROR("SERVER_ERROR", true),
    RATE_LIMIT_EXCEEDED("RATE_LIMIT_EXCEEDED", false),
    CHANNEL_DELIVERY_FAILED("CHANNEL_DELIVERY_FAILED", false),
    PROTOCOL_ERROR("PROTOCOL_ERROR", false),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;
    private final boolean retryable;

    /**
     * Maps a non-2xx HTTP status to the closest error code.
     */
    public static ErrorCode fromHttpStatus(int status) {
        return switch (status) {
            case 400 -> BAD_REQUEST;
            case 401 -> UNAUTHORIZED;
            case 403 -> FORBIDDEN;
            case 404 -> NOT_FOUND;
            case 429 -> RATE_LIMIT_EXCEEDED;
            default -> status >= 500 ? SERVER_ERROR : CLIENT_ERROR;
        };
    }
}
