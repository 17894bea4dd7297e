package com.example.s3explorer.tree;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A folder or file shown for one listing. Folders carry no size, modification time or etag.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TreeNode(
        NodeType type,
        String key,
        String name,
        Long size,
        Instant lastModified,
        String etag
) {
    public static TreeNode folder(String key, String name) {
        return new TreeNode(NodeType.FOLDER, key, name, null, null, null);
    }

    public static TreeNode file(String key, String name, long size, Instant lastModified, String etag) {
        return new TreeNode(NodeType.FILE, key, name, size, lastModified, etag);
    }
}
