package com.scorpius.event;

/**
 * Classifies the authentication lifecycle change that triggered an {@link AuthEvent}.
 */
public enum AuthEventType {

    /** Credentials accepted and a token pair stored. */
    LOGGED_IN,

    /** Token pair replaced by a successful refresh. */
    TOKEN_REFRESHED,

    /** Refresh call failed; the session is cleared right after. */
    REFRESH_FAILED,

    /**
     * Session cleared, either by an explicit logout or because the backend rejected
     * the credentials and no refresh could recover them. The UI should prompt for login.
     */
    LOGGED_OUT
}
