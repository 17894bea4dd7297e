package com.example.s3explorer.session;

public enum SessionEndReason {
    REFRESH_FAILED("refresh token rejected"),
    NO_REFRESH_TOKEN("no refresh token available"),
    SIGNED_OUT("signed out");

    private final String description;

    SessionEndReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
