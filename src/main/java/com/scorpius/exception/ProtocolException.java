package com.scorpius.exception;

/**
 * Malformed WebSocket frame. Logged by the socket manager; the connection stays open.
 */
public class ProtocolException extends BaseException {

    public ProtocolException(String message, Throwable cause) {
        super(ErrorCode.PROTOCOL_ERROR, message, cause);
    }
}
