package com.scorpius.event;

public enum SocketEventType {

    /** Handshake completed; the session is OPEN. */
    CONNECTED,

    /** Session closed, cleanly or not. */
    DISCONNECTED,

    /** Unclean close; a reconnect timer was scheduled. */
    RECONNECT_SCHEDULED,

    /** Reconnect attempts exhausted. Stays in effect until the next explicit connect. */
    CONNECTION_LOST
}
