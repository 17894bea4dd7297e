package com.example.s3explorer.tree;

import java.util.List;

public record Page<T>(
        List<T> items,
        int pageNumber,
        int pageSize,
        int totalItems,
        int totalPages
) {
    public Page {
        items = List.copyOf(items);
    }

    public boolean hasNext() {
        return pageNumber < totalPages;
    }

    public boolean hasPrevious() {
        return pageNumber > 1;
    }
}
