package com.scorpius.socket;

import lombok.Value;

/**
 * Immutable snapshot of the socket: the URL without its token, the state and the
 * consecutive failed reconnect count.
 */
@Value
public class SocketSession {

    String url;
    ConnectionState state;
    int reconnectAttempts;
}
