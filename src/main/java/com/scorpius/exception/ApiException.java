package com.scorpius.exception;

import java.util.Map;

/**
 * Normalized failure surfaced by {@link com.scorpius.api.RequestPipeline}.
 *
 * <p>Carries {@code code}, {@code message}, {@code timestamp} and {@code details}
 * so callers never need to inspect transport-level exceptions.
 */
public class ApiException extends BaseException {

    public ApiException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ApiException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public ApiException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(errorCode, message, details, cause);
    }
}
