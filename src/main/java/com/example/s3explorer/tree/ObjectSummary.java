package com.example.s3explorer.tree;

import java.time.Instant;

/**
 * One key as returned by a delimiter listing.
 */
public record ObjectSummary(
        String key,
        long size,
        Instant lastModified,
        String etag
) {
}
