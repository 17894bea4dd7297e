package com.example.s3explorer.tree;

import com.example.s3explorer.policy.AccessPolicy;

/**
 * Position inside the merged node list of one prefix. The page size is fixed for the lifetime of a
 * browsing context; moving to another prefix starts again at page 1.
 */
public record PageCursor(
        String prefix,
        int pageNumber,
        int pageSize
) {
    public PageCursor {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        prefix = prefix == null ? "" : prefix;
    }

    public static PageCursor first(String prefix, int pageSize) {
        return new PageCursor(prefix, 1, pageSize);
    }

    public PageCursor withPage(int page) {
        return new PageCursor(prefix, page, pageSize);
    }

    public PageCursor next() {
        return withPage(pageNumber + 1);
    }

    public PageCursor previous() {
        return withPage(Math.max(1, pageNumber - 1));
    }

    /**
     * Keeps the position when {@code newPrefix} names the same folder, otherwise resets to page 1.
     */
    public PageCursor navigate(String newPrefix) {
        String target = newPrefix == null ? "" : newPrefix;
        if (AccessPolicy.folderPrefix(target).equals(AccessPolicy.folderPrefix(prefix))) {
            return this;
        }
        return first(target, pageSize);
    }
}
