package com.scorpius.exception;

/**
 * Authentication failure. Only explicit {@code login} calls surface this to callers;
 * background refresh failures clear the session instead.
 */
public class AuthException extends BaseException {

    public AuthException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public AuthException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static AuthException invalidCredentials(String message) {
        return new AuthException(ErrorCode.INVALID_CREDENTIALS, message);
    }

    public static AuthException network(String message, Throwable cause) {
        return new AuthException(ErrorCode.NETWORK_ERROR, message, cause);
    }

    public static AuthException tokenExpired(String message) {
        return new AuthException(ErrorCode.TOKEN_EXPIRED, message);
    }
}
