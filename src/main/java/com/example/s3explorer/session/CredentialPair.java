package com.example.s3explorer.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Access and refresh token issued together. The two are only ever replaced as a pair.
 */
public record CredentialPair(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken
) {
    public CredentialPair {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken is required");
        }
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new IllegalArgumentException("refreshToken is required");
        }
    }

    @Override
    public String toString() {
        return "CredentialPair[accessToken=***, refreshToken=***]";
    }
}
