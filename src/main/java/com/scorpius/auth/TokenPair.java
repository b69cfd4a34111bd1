package com.scorpius.auth;

import java.time.Duration;
import java.time.Instant;
import lombok.Value;

/**
 * Access and refresh token of the live session.
 *
 * <p>{@code expiresAt} is null when neither the server nor the token itself states an
 * expiry; such a pair is always treated as due for refresh.
 */
@Value
public class TokenPair {

    String accessToken;
    String refreshToken;
    Instant expiresAt;

    public boolean expiresWithin(Duration threshold, Instant now) {
        return expiresAt == null || Duration.between(now, expiresAt).compareTo(threshold) < 0;
    }

    public boolean isExpired(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }

    @Override
    public String toString() {
        return "TokenPair(accessToken=" + mask(accessToken) + ", expiresAt=" + expiresAt + ")";
    }

    static String mask(String token) {
        if (token == null || token.length() < 8) {
            return "****";
        }
        return token.substring(0, 4) + "****";
    }
}
