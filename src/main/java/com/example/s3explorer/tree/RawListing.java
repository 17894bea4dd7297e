package com.example.s3explorer.tree;

import java.util.List;

/**
 * What the storage backend returned for one prefix: the common prefixes rolled up at the
 * delimiter and the keys sitting directly under the prefix, both in backend order.
 */
public record RawListing(
        String prefix,
        List<String> commonPrefixes,
        List<ObjectSummary> objects,
        boolean truncated
) {
    public RawListing {
        prefix = prefix == null ? "" : prefix;
        commonPrefixes = commonPrefixes == null ? List.of() : List.copyOf(commonPrefixes);
        objects = objects == null ? List.of() : List.copyOf(objects);
    }

    public static RawListing empty(String prefix) {
        return new RawListing(prefix, List.of(), List.of(), false);
    }

    public int size() {
        return commonPrefixes.size() + objects.size();
    }
}
