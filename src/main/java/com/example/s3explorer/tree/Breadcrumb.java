package com.example.s3explorer.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One segment of the path to the current prefix. The root has an empty name and path.
 */
public record Breadcrumb(
        String name,
        String path,
        boolean navigable
) {
    @JsonIgnore
    public boolean isRoot() {
        return path.isEmpty();
    }
}
