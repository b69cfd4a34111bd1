package com.scorpius.socket;

/**
 * Handle returned by {@link SocketManager#on}. Unsubscribing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
