package com.example.s3explorer.session;

import com.example.s3explorer.ExplorerException;
import com.example.s3explorer.PresignedUrl;
import com.example.s3explorer.internal.ApiErrorDecoder;
import com.example.s3explorer.internal.HttpUtil;
import com.example.s3explorer.internal.Json;
import com.example.s3explorer.tree.TreeListing;
import com.example.s3explorer.tree.TreeNode;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Explorer operations against the remote API, authenticated through a {@link SessionManager}.
 * Every call may trigger a session refresh; a 403 is reported to the caller as-is.
 */
public final class RemoteExplorerClient {

    private final SessionManager sessions;
    private final AuthEndpoint endpoint;

    public RemoteExplorerClient(SessionManager sessions, AuthEndpoint endpoint) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    public TreeListing tree(String prefix, Integer maxKeys) throws ExplorerException, InterruptedException {
        return AuthClient.await(treeAsync(prefix, maxKeys));
    }

    public CompletableFuture<TreeListing> treeAsync(String prefix, Integer maxKeys) {
        StringBuilder query = new StringBuilder("v1/files/tree?prefix=")
                .append(encode(prefix == null ? "" : prefix));
        if (maxKeys != null) {
            query.append("&max_keys=").append(maxKeys);
        }
        return call(get(query.toString())).thenApply(body -> parseTree(prefix, body));
    }

    public PresignedUrl downloadUrl(String key, Duration expiresIn) throws ExplorerException, InterruptedException {
        StringBuilder path = new StringBuilder("v1/files/download/");
        String[] segments = key.split("/", -1);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                path.append('/');
            }
            path.append(encode(segments[i]).replace("+", "%20"));
        }
        if (expiresIn != null) {
            path.append("?expires_in=").append(expiresIn.getSeconds());
        }
        JsonNode node = AuthClient.await(call(get(path.toString())).thenApply(RemoteExplorerClient::readTree));
        return new PresignedUrl(node.path("presigned_url").asText(), node.path("expires_in").asLong());
    }

    /**
     * Returns the folder key the server created.
     */
    public String createFolder(String path) throws ExplorerException, InterruptedException {
        String form = "path=" + encode(path);
        HttpRequest request = HttpRequest.newBuilder(endpoint.resolve("v1/files/create-folder"))
                .timeout(endpoint.requestTimeout())
                .header("Accept", "application/json")
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
                .build();
        JsonNode node = AuthClient.await(call(request).thenApply(RemoteExplorerClient::readTree));
        return node.path("key").asText(path);
    }

    /**
     * Uploads {@code content} as {@code fileName} into {@code folder}; a blank folder lets the server
     * pick the shared write area. Returns the key the server stored.
     */
    public String upload(String folder, String fileName, byte[] content) throws ExplorerException, InterruptedException {
        String boundary = "----s3explorer" + UUID.randomUUID().toString().replace("-", "");
        byte[] body = multipart(boundary, folder, fileName, content);
        HttpRequest request = HttpRequest.newBuilder(endpoint.resolve("v1/files/upload"))
                .timeout(endpoint.requestTimeout())
                .header("Accept", "application/json")
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        JsonNode node = AuthClient.await(call(request).thenApply(RemoteExplorerClient::readTree));
        return node.path("key").asText(null);
    }

    private CompletableFuture<byte[]> call(HttpRequest request) {
        return sessions.send(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> {
                    if (!HttpUtil.isSuccess(response.statusCode())) {
                        throw new CompletionException(ApiErrorDecoder.decode(response.statusCode(), response.body()));
                    }
                    return response.body();
                });
    }

    private HttpRequest get(String path) {
        URI uri = endpoint.resolve(path);
        try {
            return HttpUtil.json("GET", uri, null, endpoint.requestTimeout()).build();
        } catch (IOException ex) {
            throw new UncheckedIOException("build request for " + uri, ex);
        }
    }

    static TreeListing parseTree(String prefix, byte[] body) {
        JsonNode root = readTree(body);
        List<TreeNode> folders = new ArrayList<>();
        for (JsonNode folder : root.path("folders")) {
            String key = folder.path("key").asText();
            folders.add(TreeNode.folder(key, folder.path("name").asText(key)));
        }
        List<TreeNode> files = new ArrayList<>();
        for (JsonNode file : root.path("files")) {
            String key = file.path("key").asText();
            files.add(TreeNode.file(
                    key,
                    file.path("filename").asText(key),
                    file.path("size").asLong(),
                    parseInstant(file.path("last_modified").asText(null)),
                    file.path("etag").asText(null)));
        }
        String listed = root.path("prefix").asText(prefix == null ? "" : prefix);
        return new TreeListing(listed, folders, files);
    }

    private static JsonNode readTree(byte[] body) {
        try {
            return Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new UncheckedIOException("decode response: " + ex.getMessage(), ex);
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            // Offsets other than Z.
            return OffsetDateTime.parse(value).toInstant();
        }
    }

    private static byte[] multipart(String boundary, String folder, String fileName, byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(content.length + 512);
        String dash = "--" + boundary + "\r\n";
        if (folder != null && !folder.isBlank()) {
            write(out, dash);
            write(out, "Content-Disposition: form-data; name=\"path\"\r\n\r\n");
            write(out, folder + "\r\n");
        }
        write(out, dash);
        write(out, "Content-Disposition: form-data; name=\"file\"; filename=\""
                + fileName.replace("\"", "") + "\"\r\n");
        write(out, "Content-Type: application/octet-stream\r\n\r\n");
        out.writeBytes(content);
        write(out, "\r\n--" + boundary + "--\r\n");
        return out.toByteArray();
    }

    private static void write(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
