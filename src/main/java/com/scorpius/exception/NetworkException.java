package com.scorpius.exception;

import java.util.Map;

/**
 * Transport failure (connection refused, reset, timeout). Always retryable up to the retry policy.
 */
public class NetworkException extends ApiException {

    public NetworkException(String message, Throwable cause) {
        super(ErrorCode.NETWORK_ERROR, message, Map.of(), cause);
    }

    public NetworkException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(errorCode, message, details, cause);
    }
}
