package com.scorpius.auth;

import com.scorpius.api.dto.request.LoginRequest;
import com.scorpius.api.dto.response.LoginResponse;
import com.scorpius.domain.model.User;

/**
 * Remote side of authentication: the backend's {@code /auth/*} endpoints.
 *
 * <p>Implementations throw {@link com.scorpius.exception.AuthException} only:
 * INVALID_CREDENTIALS for rejected credentials, TOKEN_EXPIRED for a rejected token
 * or refresh token, NETWORK_ERROR for transport failures.
 */
public interface AuthClient {

    LoginResponse login(LoginRequest credentials);

    LoginResponse refresh(String refreshToken);

    void logout(String accessToken);

    User currentUser(String accessToken);
}
