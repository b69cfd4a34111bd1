package com.scorpius.socket;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Subscriber for one frame type. Runs on the socket's receive thread; exceptions are
 * logged and do not affect other subscribers.
 */
@FunctionalInterface
public interface SocketMessageHandler {

    void handle(JsonNode data);
}
