package com.example.s3explorer;

/**
 * Raised when a principal may not read or write a path. The message is meant to be shown as-is.
 */
public final class AccessDeniedException extends ExplorerException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public AccessDeniedException(String path) {
        this("Access denied to this path", path);
    }

    public AccessDeniedException(String message, String path) {
        super(message);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
