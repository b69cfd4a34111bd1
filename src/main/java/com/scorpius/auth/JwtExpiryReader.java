package com.scorpius.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.exceptions.JWTDecodeException;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the {@code exp} claim of an access token. The token is decoded without verifying
 * its signature: it is only inspected to decide when to refresh, the backend stays the
 * authority.
 */
@Component
public class JwtExpiryReader {

    private static final Logger log = LoggerFactory.getLogger(JwtExpiryReader.class);

    public Optional<Instant> readExpiry(String token) {
        if (token == null) {
            return Optional.empty();
        }
        try {
            Date expiresAt = JWT.decode(token).getExpiresAt();
            return Optional.ofNullable(expiresAt).map(Date::toInstant);
        } catch (JWTDecodeException e) {
            log.debug("Access token is not a decodable JWT: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
