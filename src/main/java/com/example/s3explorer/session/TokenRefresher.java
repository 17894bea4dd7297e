package com.example.s3explorer.session;

import java.util.concurrent.CompletableFuture;

/**
 * Exchanges a refresh token for a new credential pair.
 */
@FunctionalInterface
public interface TokenRefresher {
    CompletableFuture<CredentialPair> refresh(String refreshToken);
}
