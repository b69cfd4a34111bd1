package com.scorpius.unit.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.scorpius.auth.JwtExpiryReader;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JwtExpiryReaderTest {

    private static final Instant EXPIRY = Instant.parse("2026-03-02T10:00:00Z");

    private final JwtExpiryReader reader = new JwtExpiryReader();

    @Test
    void readExpiry_expClaim_returnsInstant() {
        String token = JWT.create().withSubject("u-1").withExpiresAt(EXPIRY).sign(Algorithm.HMAC256("backend-secret"));

        assertThat(reader.readExpiry(token)).contains(EXPIRY);
    }

    @Test
    void readExpiry_signedWithUnknownKey_stillReadable() {
        String token = JWT.create().withExpiresAt(EXPIRY).sign(Algorithm.HMAC512("some-other-secret"));

        assertThat(reader.readExpiry(token)).contains(EXPIRY);
    }

    @Test
    void readExpiry_noExpClaim_empty() {
        String token = JWT.create().withSubject("u-1").sign(Algorithm.HMAC256("backend-secret"));

        assertThat(reader.readExpiry(token)).isEmpty();
    }

    @Test
    void readExpiry_opaqueToken_empty() {
        assertThat(reader.readExpiry("opaque-token")).isEmpty();
        assertThat(reader.readExpiry("a.%%%.c")).isEmpty();
        assertThat(reader.readExpiry(null)).isEmpty();
    }
}
