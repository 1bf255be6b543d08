package com.tessera.service.error;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ContextSanitizer.
 */
class ContextSanitizerTest {

    private final ContextSanitizer sanitizer = new ContextSanitizer();

    @Test
    void testRedactsSensitiveKeys() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("password", "hunter2");
        context.put("accessToken", "abc");
        context.put("clientSecret", "s3cr3t");
        context.put("apiKey", "key");
        context.put("api_key", "key");
        context.put("Authorization", "Bearer x");
        context.put("credentials", "user:pass");
        context.put("projectPath", "/work/app");

        Map<String, Object> sanitized = sanitizer.sanitize(context);

        assertEquals("[REDACTED]", sanitized.get("password"));
        assertEquals("[REDACTED]", sanitized.get("accessToken"));
        assertEquals("[REDACTED]", sanitized.get("clientSecret"));
        assertEquals("[REDACTED]", sanitized.get("apiKey"));
        assertEquals("[REDACTED]", sanitized.get("api_key"));
        assertEquals("[REDACTED]", sanitized.get("Authorization"));
        assertEquals("[REDACTED]", sanitized.get("credentials"));
        assertEquals("/work/app", sanitized.get("projectPath"));
    }

    @Test
    void testTruncatesLongStrings() {
        Map<String, Object> sanitized = sanitizer.sanitize(Map.of("output", "a".repeat(1500), "short", "b"));

        String output = (String) sanitized.get("output");
        assertEquals(1000 + "...[TRUNCATED]".length(), output.length());
        assertTrue(output.endsWith("...[TRUNCATED]"));
        assertEquals("b", sanitized.get("short"));
    }

    @Test
    void testSanitizesNestedMapsAndLists() {
        Map<String, Object> sanitized = sanitizer.sanitize(Map.of(
                "request", Map.of("token", "abc", "path", "/x"),
                "items", List.of("ok", "c".repeat(1001))));

        @SuppressWarnings("unchecked")
        Map<String, Object> request = (Map<String, Object>) sanitized.get("request");
        assertEquals("[REDACTED]", request.get("token"));
        assertEquals("/x", request.get("path"));

        List<?> items = (List<?>) sanitized.get("items");
        assertEquals("ok", items.get(0));
        assertTrue(((String) items.get(1)).endsWith("...[TRUNCATED]"));
    }

    @Test
    void testEmptyContext() {
        assertTrue(sanitizer.sanitize(null).isEmpty());
        assertTrue(sanitizer.sanitize(Map.of()).isEmpty());
    }
}
