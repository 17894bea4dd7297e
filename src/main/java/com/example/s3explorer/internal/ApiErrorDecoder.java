package com.example.s3explorer.internal;

import com.example.s3explorer.ExplorerApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Decodes error payloads from the explorer API. Understands {@code {"detail": ...}},
 * {@code {"code", "message"}} and {@code {"error": ...}} bodies; anything else becomes the message.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static ExplorerApiException decode(int statusCode, byte[] body) {
        if (body == null || body.length == 0) {
            return new ExplorerApiException(statusCode, null, null);
        }
        try {
            JsonNode node = MAPPER.readTree(body);
            if (node == null || !node.isObject()) {
                return new ExplorerApiException(statusCode, null, new String(body, StandardCharsets.UTF_8));
            }
            String code = node.hasNonNull("code") ? node.get("code").asText()
                    : node.hasNonNull("error") ? node.get("error").asText() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText()
                    : node.hasNonNull("detail") ? detail(node.get("detail")) : null;
            return new ExplorerApiException(statusCode, code, message);
        } catch (IOException ex) {
            return new ExplorerApiException(statusCode, null, new String(body, StandardCharsets.UTF_8));
        }
    }

    private static String detail(JsonNode detail) {
        // Validation errors arrive as an array of {msg, ...} objects.
        if (detail.isArray() && detail.size() > 0 && detail.get(0).hasNonNull("msg")) {
            return detail.get(0).get("msg").asText();
        }
        return detail.isTextual() ? detail.asText() : detail.toString();
    }
}
