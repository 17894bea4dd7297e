package com.example.s3explorer;

public final class ObjectNotFoundException extends ExplorerException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public ObjectNotFoundException(String key) {
        super("File not found: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
