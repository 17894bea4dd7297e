package com.example.s3explorer.session;

import com.example.s3explorer.ExplorerException;
import com.example.s3explorer.internal.ApiErrorDecoder;
import com.example.s3explorer.internal.HttpUtil;
import com.example.s3explorer.internal.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Blocking sign-in, sign-out and profile lookup on top of a {@link SessionManager}.
 */
public final class AuthClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuthClient.class);

    private final AuthEndpoint endpoint;
    private final SessionManager sessions;

    public AuthClient(AuthEndpoint endpoint, SessionManager sessions) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    /**
     * Exchanges email and password for a credential pair and makes it the current session.
     */
    public void login(String email, String password) throws ExplorerException, InterruptedException {
        CredentialPair pair = await(endpoint.login(email, password));
        sessions.establish(pair);
        LOGGER.info("Signed in as {}", email);
    }

    /**
     * Revokes the refresh token server-side and clears local credentials. Local credentials are
     * cleared even when the server call fails.
     */
    public void logout() throws InterruptedException {
        Optional<CredentialPair> current = sessions.credentials();
        try {
            if (current.isPresent()) {
                await(endpoint.logout(current.get().refreshToken()));
            }
        } catch (ExplorerException ex) {
            LOGGER.warn("Server-side logout failed; clearing local session anyway", ex);
        } finally {
            sessions.signOut();
        }
    }

    public UserProfile me() throws ExplorerException, InterruptedException {
        HttpRequest request;
        try {
            request = HttpUtil.json("GET", endpoint.resolve("v1/auth/me"), null, endpoint.requestTimeout()).build();
        } catch (IOException ex) {
            throw new ExplorerException("Failed to build profile request", ex);
        }
        HttpResponse<byte[]> response = await(sessions.send(request, HttpResponse.BodyHandlers.ofByteArray()));
        if (!HttpUtil.isSuccess(response.statusCode())) {
            throw ApiErrorDecoder.decode(response.statusCode(), response.body());
        }
        try {
            return Json.mapper().readValue(response.body(), UserProfile.class);
        } catch (IOException ex) {
            throw new ExplorerException("Malformed profile response", ex);
        }
    }

    static <T> T await(CompletableFuture<T> future) throws ExplorerException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof ExplorerException) {
                throw (ExplorerException) cause;
            }
            throw new ExplorerException(cause == null ? ex.getMessage() : String.valueOf(cause.getMessage()), cause);
        }
    }
}
