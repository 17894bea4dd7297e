package com.example.s3explorer;

/**
 * The storage backend was unreachable or answered with something we could not use.
 */
public class StorageException extends ExplorerException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
