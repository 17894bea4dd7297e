package com.example.s3explorer.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Children of one prefix.
 */
public record TreeListing(
        String prefix,
        List<TreeNode> folders,
        List<TreeNode> files
) {
    public TreeListing {
        folders = List.copyOf(folders);
        files = List.copyOf(files);
    }

    /**
     * Folders first, then files, each in listing order.
     */
    @JsonIgnore
    public List<TreeNode> nodes() {
        List<TreeNode> merged = new ArrayList<>(folders.size() + files.size());
        merged.addAll(folders);
        merged.addAll(files);
        return merged;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return folders.isEmpty() && files.isEmpty();
    }
}
