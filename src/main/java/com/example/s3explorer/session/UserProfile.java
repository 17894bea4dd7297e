package com.example.s3explorer.session;

import com.example.s3explorer.policy.Principal;
import com.example.s3explorer.policy.Role;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The signed-in user as reported by {@code /v1/auth/me}.
 */
public record UserProfile(
        String id,
        String email,
        @JsonProperty("full_name") String fullName,
        String role,
        @JsonProperty("allowed_path_prefix") String allowedPathPrefix
) {
    public Principal toPrincipal() {
        return new Principal(id, Role.fromValue(role), allowedPathPrefix);
    }
}
