package com.scorpius.api.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.scorpius.domain.model.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code /auth/login} and {@code /auth/refresh}.
 *
 * <p>{@code expiresIn} is in seconds. Some deployments omit it; the expiry is then read
 * from the access token's {@code exp} claim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoginResponse {

    private User user;
    private String accessToken;
    private String refreshToken;
    private Long expiresIn;
}
