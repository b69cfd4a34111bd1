package com.scorpius.socket;

/**
 * Lifecycle of the single backend WebSocket.
 *
 * <pre>
 * IDLE -> CONNECTING -> OPEN -> IDLE            (clean close, code 1000)
 *                            -> RECONNECT_WAIT  (unclean close, attempts left) -> CONNECTING
 * any -> CLOSING -> IDLE                        (explicit disconnect)
 * </pre>
 */
public enum ConnectionState {
    IDLE,
    CONNECTING,
    OPEN,
    CLOSING,
    RECONNECT_WAIT
}
