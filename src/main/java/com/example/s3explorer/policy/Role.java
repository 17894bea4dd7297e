package com.example.s3explorer.policy;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum Role {
    ADMIN("admin", EnumSet.allOf(Permission.class)),
    EDITOR("editor", EnumSet.of(Permission.FILES_READ, Permission.FILES_WRITE, Permission.FILES_DELETE,
            Permission.ANALYTICS_READ)),
    VIEWER("viewer", EnumSet.of(Permission.FILES_READ, Permission.ANALYTICS_READ)),
    EXTERNAL_VIEWER("external_viewer", EnumSet.of(Permission.FILES_READ));

    private final String value;
    private final Set<Permission> permissions;

    Role(String value, Set<Permission> permissions) {
        this.value = value;
        this.permissions = permissions;
    }

    /**
     * Wire name used by the user-management collaborator.
     */
    public String value() {
        return value;
    }

    public boolean grants(Permission permission) {
        return permissions.contains(permission);
    }

    public static Role fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Role is required.");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + raw);
    }
}
