package com.example.s3explorer;

/**
 * A temporary download link and its lifetime in seconds.
 */
public record PresignedUrl(String url, long expiresIn) {
}
