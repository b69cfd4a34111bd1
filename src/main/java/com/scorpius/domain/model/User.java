package com.scorpius.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Authenticated user as returned by {@code /auth/login} and {@code /auth/me}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class User {

    private String id;
    private String username;
    private String email;

    /** One of admin, analyst, viewer. */
    private String role;

    private List<String> permissions;
    private String lastLoginAt;
    private String createdAt;
    private String updatedAt;
}
