package com.example.s3explorer.internal;

import com.example.s3explorer.ExplorerApiException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiErrorDecoderTest {
    @Test
    void readsDetailMessage() {
        ExplorerApiException ex = ApiErrorDecoder.decode(403, bytes("{\"detail\": \"Access denied to this path\"}"));

        assertTrue(ex.isAuthorizationDenied());
        assertEquals("Access denied to this path", ex.getMessage());
        assertNull(ex.getCode());
    }

    @Test
    void readsFirstValidationError() {
        ExplorerApiException ex = ApiErrorDecoder.decode(422,
                bytes("{\"detail\": [{\"loc\": [\"body\", \"path\"], \"msg\": \"field required\"}]}"));

        assertEquals("field required", ex.getMessage());
    }

    @Test
    void readsCodeAndMessage() {
        ExplorerApiException ex = ApiErrorDecoder.decode(404, bytes("{\"code\": \"not_found\", \"message\": \"File not found\"}"));

        assertTrue(ex.isNotFound());
        assertEquals("not_found", ex.getCode());
        assertEquals("File not found", ex.getMessage());
    }

    @Test
    void fallsBackToRawBodyOrStatus() {
        assertEquals("Bad gateway", ApiErrorDecoder.decode(502, bytes("Bad gateway")).getMessage());
        assertEquals("Request failed with status 500", ApiErrorDecoder.decode(500, new byte[0]).getMessage());
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
