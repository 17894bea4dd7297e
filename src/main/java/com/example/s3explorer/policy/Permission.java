package com.example.s3explorer.policy;

/**
 * Access rules a role may grant.
 */
public enum Permission {
    FILES_READ("files:read", "Read / List", "View and list files and folders"),
    FILES_WRITE("files:write", "Upload", "Upload files"),
    FILES_DELETE("files:delete", "Delete", "Delete files"),
    ANALYTICS_READ("analytics:read", "Analytics", "View analytics and activity trends");

    private final String id;
    private final String label;
    private final String description;

    Permission(String id, String label, String description) {
        this.id = id;
        this.label = label;
        this.description = description;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }
}
