package com.scorpius.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    private String username;

    @NotBlank
    private String password;

    private boolean rememberMe;

    @Override
    public String toString() {
        return "LoginRequest(username=" + username + ", rememberMe=" + rememberMe + ")";
    }
}
