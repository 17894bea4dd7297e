package com.example.s3explorer;

/**
 * Base exception thrown by the explorer core.
 */
public class ExplorerException extends Exception {

    private static final long serialVersionUID = 1L;

    public ExplorerException(String message) {
        super(message);
    }

    public ExplorerException(String message, Throwable cause) {
        super(message, cause);
    }
}
