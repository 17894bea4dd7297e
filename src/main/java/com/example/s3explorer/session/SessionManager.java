package com.example.s3explorer.session;

import com.example.s3explorer.internal.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;

/**
 * Owns the end-user session: attaches the access token to outgoing calls and renews it when the
 * server answers 401.
 *
 * <p>Renewal is single-flight. The first call to see an expired token starts the refresh; calls that
 * see the expiry while it runs wait on the same result and are replayed only after it resolves. A
 * 401 for a token that has already been replaced is replayed with the current pair without another
 * refresh. A failed refresh clears the credentials, ends the session and is never retried.</p>
 *
 * <p>Authentication endpoints are passed through untouched, as are 403 responses. Cancelling the
 * future returned by {@link #send} affects only that caller.</p>
 */
public final class SessionManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    enum RefreshState {
        IDLE,
        REFRESHING,
        FAILED
    }

    /**
     * A call as issued by the caller, plus the token it went out with and whether it is already a replay.
     */
    public record PendingCall<T>(
            HttpRequest request,
            HttpResponse.BodyHandler<T> bodyHandler,
            String accessToken,
            boolean retry
    ) {
        PendingCall<T> sentWith(String token) {
            return new PendingCall<>(request, bodyHandler, token, retry);
        }

        PendingCall<T> asRetry() {
            return new PendingCall<>(request, bodyHandler, null, true);
        }
    }

    private final HttpClient httpClient;
    private final CredentialStore store;
    private final TokenRefresher refresher;
    private final SessionListener listener;
    private final Predicate<URI> authEndpoint;

    private final Object lock = new Object();
    private RefreshState state = RefreshState.IDLE;
    private CompletableFuture<CredentialPair> inFlight;
    // The refresh call actually running, which can outlive the session that started it.
    private CompletableFuture<CredentialPair> outstanding;
    // Bumped whenever credentials are replaced from outside; a refresh from an older generation is discarded.
    private long generation;

    public SessionManager(HttpClient httpClient,
                          CredentialStore store,
                          TokenRefresher refresher,
                          SessionListener listener) {
        this(httpClient, store, refresher, listener, SessionManager::isAuthPath);
    }

    public SessionManager(HttpClient httpClient,
                          CredentialStore store,
                          TokenRefresher refresher,
                          SessionListener listener,
                          Predicate<URI> authEndpoint) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.store = Objects.requireNonNull(store, "store");
        this.refresher = Objects.requireNonNull(refresher, "refresher");
        this.listener = listener == null ? SessionListener.noop() : listener;
        this.authEndpoint = Objects.requireNonNull(authEndpoint, "authEndpoint");
    }

    /**
     * Returns {@code request} with the current access token as bearer authorization. Without
     * credentials the request goes out unauthenticated.
     */
    public HttpRequest attach(HttpRequest request) {
        Optional<CredentialPair> current = store.read();
        if (current.isEmpty()) {
            return request;
        }
        return authorized(request, current.get().accessToken());
    }

    /**
     * Sends {@code request} with the session's credentials, renewing them once if they have expired.
     * Fails with {@link SessionExpiredException} when the session cannot be renewed.
     */
    public <T> CompletableFuture<HttpResponse<T>> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler) {
        return dispatch(new PendingCall<>(request, bodyHandler, null, false));
    }

    /**
     * Handles the response to {@code call}: passes it through, or on an expiry signal renews the
     * session and replays the call once.
     */
    public <T> CompletableFuture<HttpResponse<T>> onResponse(PendingCall<T> call, HttpResponse<T> response) {
        if (response.statusCode() != 401 || call.retry() || authEndpoint.test(call.request().uri())) {
            return CompletableFuture.completedFuture(response);
        }
        return renew(call.accessToken())
                .thenCompose(ignored -> dispatch(call.asRetry()));
    }

    /**
     * Stores a freshly issued pair, e.g. after sign-in, and leaves any failed state. Calls waiting on
     * a refresh that is still running are replayed with this pair once it settles.
     */
    public void establish(CredentialPair pair) {
        synchronized (lock) {
            generation++;
            store.write(pair);
            state = RefreshState.IDLE;
            inFlight = null;
        }
    }

    /**
     * Clears the credentials. Calls waiting on a refresh that is still running will fail once it
     * settles.
     */
    public void signOut() {
        synchronized (lock) {
            generation++;
            store.clear();
            state = RefreshState.IDLE;
            inFlight = null;
        }
        LOGGER.info("Signed out");
        listener.sessionEnded(SessionEndReason.SIGNED_OUT);
    }

    public Optional<CredentialPair> credentials() {
        return store.read();
    }

    RefreshState state() {
        synchronized (lock) {
            return state;
        }
    }

    private <T> CompletableFuture<HttpResponse<T>> dispatch(PendingCall<T> call) {
        String token = store.read().map(CredentialPair::accessToken).orElse(null);
        HttpRequest outgoing = token == null ? call.request() : authorized(call.request(), token);
        PendingCall<T> sent = call.sentWith(token);
        return httpClient.sendAsync(outgoing, call.bodyHandler())
                .thenCompose(response -> onResponse(sent, response));
    }

    /**
     * Resolves to the pair a call that failed with {@code staleToken} should be replayed with.
     */
    private CompletableFuture<CredentialPair> renew(String staleToken) {
        CompletableFuture<CredentialPair> pending;
        CompletableFuture<CredentialPair> call;
        CompletableFuture<?> previous;
        String refreshToken;
        long startedAt;
        synchronized (lock) {
            Optional<CredentialPair> current = store.read();
            switch (state) {
                case REFRESHING:
                    LOGGER.debug("Joining in-flight refresh");
                    return inFlight.thenApply(pair -> pair);
                case FAILED:
                    return CompletableFuture.failedFuture(new SessionExpiredException(SessionEndReason.REFRESH_FAILED));
                default:
                    break;
            }
            if (current.isPresent() && !current.get().accessToken().equals(staleToken)) {
                // Already renewed for this expiry, or the call went out before credentials existed.
                return CompletableFuture.completedFuture(current.get());
            }
            if (current.isEmpty()) {
                state = RefreshState.FAILED;
                pending = null;
                call = null;
                previous = null;
                refreshToken = null;
                startedAt = generation;
            } else {
                state = RefreshState.REFRESHING;
                inFlight = new CompletableFuture<>();
                pending = inFlight;
                refreshToken = current.get().refreshToken();
                startedAt = generation;
                // A refresh from a replaced session may still be running; ours starts after it settles.
                previous = outstanding;
                call = new CompletableFuture<>();
                outstanding = call;
            }
        }
        if (pending == null) {
            endSession(SessionEndReason.NO_REFRESH_TOKEN, null);
            return CompletableFuture.failedFuture(new SessionExpiredException(SessionEndReason.NO_REFRESH_TOKEN));
        }

        CompletableFuture<Void> ready = previous == null
                ? CompletableFuture.completedFuture(null)
                : previous.handle((ignored, error) -> null);
        ready.thenCompose(ignored -> startRefresh(refreshToken))
                .whenComplete((pair, error) -> {
                    if (error == null) {
                        call.complete(pair);
                    } else {
                        call.completeExceptionally(unwrap(error));
                    }
                });
        call.whenComplete((pair, error) -> completeRefresh(call, pending, startedAt, pair, error));
        return pending.thenApply(pair -> pair);
    }

    private CompletableFuture<CredentialPair> startRefresh(String refreshToken) {
        LOGGER.debug("Access token expired; refreshing");
        try {
            return refresher.refresh(refreshToken);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private void completeRefresh(CompletableFuture<CredentialPair> call, CompletableFuture<CredentialPair> pending,
                                 long startedAt, CredentialPair pair, Throwable error) {
        Throwable failure = error == null && pair == null
                ? new IllegalStateException("refresh returned no credentials")
                : unwrap(error);
        boolean stale;
        CompletableFuture<CredentialPair> successor = null;
        Optional<CredentialPair> replacement = Optional.empty();
        synchronized (lock) {
            if (outstanding == call) {
                outstanding = null;
            }
            stale = startedAt != generation;
            if (stale) {
                successor = state == RefreshState.REFRESHING ? inFlight : null;
                replacement = store.read();
            }
            if (!stale && failure == null) {
                try {
                    store.write(pair);
                    state = RefreshState.IDLE;
                    inFlight = null;
                } catch (RuntimeException ex) {
                    failure = ex;
                }
            }
            if (!stale && failure != null) {
                store.clear();
                state = RefreshState.FAILED;
                inFlight = null;
            }
        }
        if (stale) {
            LOGGER.debug("Discarding refresh result; session changed while it was running");
            if (successor != null) {
                successor.whenComplete((next, nextError) -> {
                    if (nextError == null) {
                        pending.complete(next);
                    } else {
                        pending.completeExceptionally(nextError);
                    }
                });
            } else if (replacement.isPresent()) {
                pending.complete(replacement.get());
            } else {
                pending.completeExceptionally(new SessionExpiredException(SessionEndReason.SIGNED_OUT, failure));
            }
        } else if (failure == null) {
            LOGGER.info("Session refreshed");
            pending.complete(pair);
        } else {
            endSession(SessionEndReason.REFRESH_FAILED, failure);
            pending.completeExceptionally(new SessionExpiredException(SessionEndReason.REFRESH_FAILED, failure));
        }
    }

    private void endSession(SessionEndReason reason, Throwable cause) {
        if (cause == null) {
            LOGGER.warn("Session ended: {}", reason.description());
        } else {
            LOGGER.warn("Session ended: {}", reason.description(), cause);
        }
        synchronized (lock) {
            store.clear();
        }
        listener.sessionEnded(reason);
    }

    private static HttpRequest authorized(HttpRequest request, String token) {
        return HttpRequest.newBuilder(request, (name, value) -> !name.equalsIgnoreCase(HttpUtil.AUTHORIZATION))
                .header(HttpUtil.AUTHORIZATION, HttpUtil.BEARER + token)
                .build();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    static boolean isAuthPath(URI uri) {
        String path = uri.getPath();
        return path != null && path.contains("/auth/");
    }
}
