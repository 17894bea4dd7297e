package com.example.s3explorer.policy;

import java.util.Objects;
import java.util.Optional;

/**
 * Caller identity as supplied by user management. A blank {@code allowedPathPrefix} is stored as
 * {@code null}, which means unrestricted.
 */
public record Principal(String id, Role role, String allowedPathPrefix) {

    public Principal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        allowedPathPrefix = allowedPathPrefix == null || allowedPathPrefix.isBlank()
                ? null
                : allowedPathPrefix.trim();
    }

    public static Principal unrestricted(String id, Role role) {
        return new Principal(id, role, null);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    /**
     * The read restriction in force, empty for admins and for principals without a prefix.
     */
    public Optional<String> readRestriction() {
        if (isAdmin()) {
            return Optional.empty();
        }
        return Optional.ofNullable(allowedPathPrefix);
    }
}
