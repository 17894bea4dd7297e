package com.example.s3explorer.session;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionManagerTest {
    private HttpServer server;
    private ExecutorService serverExecutor;
    private URI baseUri;
    private final AtomicReference<String> validToken = new AtomicReference<>("fresh");
    private final CountDownLatch twoRejected = new CountDownLatch(2);

    private final InMemoryCredentialStore store = new InMemoryCredentialStore();
    private final List<SessionEndReason> ended = new CopyOnWriteArrayList<>();
    private final AtomicInteger refreshCalls = new AtomicInteger();
    private final CountDownLatch refreshStarted = new CountDownLatch(1);
    private final CompletableFuture<CredentialPair> refreshGate = new CompletableFuture<>();

    private SessionManager sessions;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newFixedThreadPool(8);
        server.setExecutor(serverExecutor);
        server.createContext("/v1/files/", this::files);
        server.createContext("/v1/auth/me", exchange -> respond(exchange, 401, "{\"detail\": \"Not authenticated\"}"));
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/");

        TokenRefresher refresher = refreshToken -> {
            refreshCalls.incrementAndGet();
            refreshStarted.countDown();
            return refreshGate;
        };
        sessions = new SessionManager(HttpClient.newHttpClient(), store, refresher, ended::add);
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void concurrentExpiriesShareOneRefresh() throws Exception {
        store.write(new CredentialPair("stale", "refresh-1"));

        CompletableFuture<HttpResponse<String>> first = sessions.send(get("v1/files/tree"), ofString());
        CompletableFuture<HttpResponse<String>> second = sessions.send(get("v1/files/tree"), ofString());
        assertTrue(twoRejected.await(5, TimeUnit.SECONDS));
        assertTrue(refreshStarted.await(5, TimeUnit.SECONDS));
        refreshGate.complete(new CredentialPair("fresh", "refresh-2"));

        assertEquals(200, first.get(5, TimeUnit.SECONDS).statusCode());
        assertEquals(200, second.get(5, TimeUnit.SECONDS).statusCode());
        assertEquals(1, refreshCalls.get());
        assertEquals("refresh-2", store.read().orElseThrow().refreshToken());
        assertEquals(SessionManager.RefreshState.IDLE, sessions.state());
        assertTrue(ended.isEmpty());
    }

    @Test
    void failedRefreshEndsSessionForEveryWaiter() throws Exception {
        store.write(new CredentialPair("stale", "revoked"));

        CompletableFuture<HttpResponse<String>> first = sessions.send(get("v1/files/tree"), ofString());
        CompletableFuture<HttpResponse<String>> second = sessions.send(get("v1/files/tree"), ofString());
        assertTrue(twoRejected.await(5, TimeUnit.SECONDS));
        assertTrue(refreshStarted.await(5, TimeUnit.SECONDS));
        refreshGate.completeExceptionally(new IllegalStateException("refresh token revoked"));

        for (CompletableFuture<HttpResponse<String>> call : List.of(first, second)) {
            ExecutionException ex = assertThrows(ExecutionException.class, () -> call.get(5, TimeUnit.SECONDS));
            SessionExpiredException expired = assertInstanceOf(SessionExpiredException.class, ex.getCause());
            assertEquals(SessionEndReason.REFRESH_FAILED, expired.getReason());
        }
        assertEquals(1, refreshCalls.get());
        assertTrue(store.read().isEmpty());
        assertEquals(List.of(SessionEndReason.REFRESH_FAILED), ended);
        assertEquals(SessionManager.RefreshState.FAILED, sessions.state());
    }

    @Test
    void signingInAgainLeavesFailedState() throws Exception {
        refreshGate.completeExceptionally(new IllegalStateException("revoked"));
        store.write(new CredentialPair("stale", "revoked"));
        CompletableFuture<HttpResponse<String>> call = sessions.send(get("v1/files/tree"), ofString());
        assertThrows(ExecutionException.class, () -> call.get(5, TimeUnit.SECONDS));

        sessions.establish(new CredentialPair("fresh", "refresh-2"));

        assertEquals(SessionManager.RefreshState.IDLE, sessions.state());
        assertEquals(200, sessions.send(get("v1/files/tree"), ofString()).get(5, TimeUnit.SECONDS).statusCode());
    }

    @Test
    void refreshFromReplacedSessionStillGatesTheNextOne() throws Exception {
        List<CompletableFuture<CredentialPair>> gates = List.of(new CompletableFuture<>(), new CompletableFuture<>());
        List<String> usedRefreshTokens = new CopyOnWriteArrayList<>();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger mostRunning = new AtomicInteger();
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch secondStarted = new CountDownLatch(1);
        TokenRefresher refresher = refreshToken -> {
            int index = usedRefreshTokens.size();
            usedRefreshTokens.add(refreshToken);
            mostRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            (index == 0 ? firstStarted : secondStarted).countDown();
            return gates.get(index).whenComplete((pair, error) -> running.decrementAndGet());
        };
        SessionManager manager = new SessionManager(HttpClient.newHttpClient(), store, refresher, ended::add);

        store.write(new CredentialPair("stale-1", "refresh-1"));
        CompletableFuture<HttpResponse<String>> first = manager.send(get("v1/files/tree"), ofString());
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

        manager.establish(new CredentialPair("stale-2", "refresh-2"));
        CompletableFuture<HttpResponse<String>> second = manager.send(get("v1/files/tree"), ofString());
        assertTrue(twoRejected.await(5, TimeUnit.SECONDS));
        awaitState(manager, SessionManager.RefreshState.REFRESHING);
        assertEquals(1, usedRefreshTokens.size());

        gates.get(0).complete(new CredentialPair("from-old-session", "refresh-old"));
        assertTrue(secondStarted.await(5, TimeUnit.SECONDS));
        gates.get(1).complete(new CredentialPair("fresh", "refresh-3"));

        assertEquals(200, second.get(5, TimeUnit.SECONDS).statusCode());
        assertEquals(200, first.get(5, TimeUnit.SECONDS).statusCode());
        assertEquals(1, mostRunning.get());
        assertEquals(List.of("refresh-1", "refresh-2"), usedRefreshTokens);
        assertEquals("refresh-3", store.read().orElseThrow().refreshToken());
        assertTrue(ended.isEmpty());
    }

    @Test
    void waitersOfReplacedSessionReplayWithNewPair() throws Exception {
        store.write(new CredentialPair("stale", "refresh-1"));
        CompletableFuture<HttpResponse<String>> call = sessions.send(get("v1/files/tree"), ofString());
        assertTrue(refreshStarted.await(5, TimeUnit.SECONDS));

        sessions.establish(new CredentialPair("fresh", "refresh-2"));
        refreshGate.complete(new CredentialPair("from-old-session", "refresh-old"));

        assertEquals(200, call.get(5, TimeUnit.SECONDS).statusCode());
        assertEquals("refresh-2", store.read().orElseThrow().refreshToken());
        assertEquals(1, refreshCalls.get());
    }

    @Test
    void forbiddenIsNotAnExpirySignal() throws Exception {
        store.write(new CredentialPair("fresh", "refresh-1"));

        HttpResponse<String> response = sessions.send(get("v1/files/forbidden"), ofString()).get(5, TimeUnit.SECONDS);

        assertEquals(403, response.statusCode());
        assertEquals(0, refreshCalls.get());
    }

    @Test
    void authEndpointRejectionIsPassedThrough() throws Exception {
        store.write(new CredentialPair("stale", "refresh-1"));

        HttpResponse<String> response = sessions.send(get("v1/auth/me"), ofString()).get(5, TimeUnit.SECONDS);

        assertEquals(401, response.statusCode());
        assertEquals(0, refreshCalls.get());
        assertTrue(store.read().isPresent());
    }

    @Test
    void cancellingOneWaiterDoesNotAffectTheOther() throws Exception {
        store.write(new CredentialPair("stale", "refresh-1"));

        CompletableFuture<HttpResponse<String>> first = sessions.send(get("v1/files/tree"), ofString());
        CompletableFuture<HttpResponse<String>> second = sessions.send(get("v1/files/tree"), ofString());
        assertTrue(twoRejected.await(5, TimeUnit.SECONDS));
        assertTrue(refreshStarted.await(5, TimeUnit.SECONDS));
        first.cancel(true);
        refreshGate.complete(new CredentialPair("fresh", "refresh-2"));

        assertEquals(200, second.get(5, TimeUnit.SECONDS).statusCode());
        assertTrue(first.isCancelled());
        assertEquals(1, refreshCalls.get());
    }

    @Test
    void missingCredentialsEndSessionWithoutRefresh() throws Exception {
        CompletableFuture<HttpResponse<String>> call = sessions.send(get("v1/files/tree"), ofString());

        ExecutionException ex = assertThrows(ExecutionException.class, () -> call.get(5, TimeUnit.SECONDS));
        SessionExpiredException expired = assertInstanceOf(SessionExpiredException.class, ex.getCause());
        assertEquals(SessionEndReason.NO_REFRESH_TOKEN, expired.getReason());
        assertEquals(0, refreshCalls.get());
        assertEquals(List.of(SessionEndReason.NO_REFRESH_TOKEN), ended);
    }

    @Test
    void attachReplacesAuthorizationHeader() {
        store.write(new CredentialPair("fresh", "refresh-1"));
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve("v1/files/tree"))
                .header("Authorization", "Bearer old")
                .build();

        HttpRequest attached = sessions.attach(request);

        assertEquals(List.of("Bearer fresh"), attached.headers().allValues("Authorization"));
    }

    private static void awaitState(SessionManager manager, SessionManager.RefreshState expected)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (manager.state() != expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(expected, manager.state());
    }

    private void files(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (path.endsWith("/forbidden")) {
            respond(exchange, 403, "{\"detail\": \"Access denied to this path\"}");
            return;
        }
        String authorization = exchange.getRequestHeaders().getFirst("Authorization");
        if (("Bearer " + validToken.get()).equals(authorization)) {
            respond(exchange, 200, "{\"folders\": [], \"files\": []}");
            return;
        }
        twoRejected.countDown();
        respond(exchange, 401, "{\"detail\": \"Token expired\"}");
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder(baseUri.resolve(path)).GET().build();
    }

    private static HttpResponse.BodyHandler<String> ofString() {
        return HttpResponse.BodyHandlers.ofString();
    }
}
