package com.scorpius.auth;

/**
 * Authentication lifecycle of the process.
 *
 * <pre>
 * ANONYMOUS -> AUTHENTICATING -> AUTHENTICATED -> REFRESHING -> AUTHENTICATED
 *                                                            -> ANONYMOUS (refresh failed)
 * any state -> ANONYMOUS (logout or unrecoverable 401)
 * </pre>
 */
public enum AuthState {
    ANONYMOUS,
    AUTHENTICATING,
    AUTHENTICATED,
    REFRESHING;

    public boolean hasSession() {
        return this == AUTHENTICATED || this == REFRESHING;
    }
}
