package com.example.s3explorer.session;

import com.example.s3explorer.internal.ApiErrorDecoder;
import com.example.s3explorer.internal.HttpUtil;
import com.example.s3explorer.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Raw calls to the {@code /v1/auth} endpoints. These bypass the session manager: a 401 from here
 * is an answer, not an expiry signal.
 */
public final class AuthEndpoint implements TokenRefresher {

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Duration requestTimeout;

    public AuthEndpoint(HttpClient httpClient, URI baseUri, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
                ? Duration.ofSeconds(30) : requestTimeout;
    }

    public CompletableFuture<CredentialPair> login(String email, String password) {
        return exchange(post("v1/auth/login", Map.of("email", email, "password", password)));
    }

    @Override
    public CompletableFuture<CredentialPair> refresh(String refreshToken) {
        return exchange(post("v1/auth/refresh", Map.of("refresh_token", refreshToken)));
    }

    public CompletableFuture<Void> logout(String refreshToken) {
        HttpRequest request = post("v1/auth/logout", Map.of("refresh_token", refreshToken));
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> {
                    if (!HttpUtil.isSuccess(response.statusCode())) {
                        throw new CompletionException(
                                ApiErrorDecoder.decode(response.statusCode(), response.body()));
                    }
                    return null;
                });
    }

    public URI resolve(String path) {
        return baseUri.resolve(path);
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    private CompletableFuture<CredentialPair> exchange(HttpRequest request) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> {
                    if (!HttpUtil.isSuccess(response.statusCode())) {
                        throw new CompletionException(
                                ApiErrorDecoder.decode(response.statusCode(), response.body()));
                    }
                    return decodePair(response.body());
                });
    }

    private HttpRequest post(String path, Map<String, String> payload) {
        try {
            return HttpUtil.json("POST", baseUri.resolve(path), payload, requestTimeout).build();
        } catch (IOException ex) {
            throw new UncheckedIOException("encode " + path + " payload", ex);
        }
    }

    private static CredentialPair decodePair(byte[] body) {
        try {
            JsonNode node = Json.mapper().readTree(body);
            String accessToken = node.path("access_token").asText(null);
            String refreshToken = node.path("refresh_token").asText(null);
            if (accessToken == null || accessToken.isBlank() || refreshToken == null || refreshToken.isBlank()) {
                throw new IllegalStateException("token response missing access_token or refresh_token");
            }
            return new CredentialPair(accessToken, refreshToken);
        } catch (IOException ex) {
            throw new UncheckedIOException("decode token response: " + ex.getMessage(), ex);
        }
    }
}
