package com.example.s3explorer.tree;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeType {
    FOLDER,
    FILE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
