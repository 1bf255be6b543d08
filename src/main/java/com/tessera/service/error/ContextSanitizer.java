package com.tessera.service.error;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Removes secrets and oversized values from error context before it leaves the process.
 */
public class ContextSanitizer {

    static final String REDACTED = "[REDACTED]";
    static final String TRUNCATED_SUFFIX = "...[TRUNCATED]";
    static final int MAX_STRING_LENGTH = 1000;

    private static final List<String> SENSITIVE_KEY_FRAGMENTS = List.of(
            "password", "token", "secret", "apikey", "api_key", "credential", "authorization");

    public Map<String, Object> sanitize(Map<String, ?> context) {
        if (context == null || context.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> sanitized = new LinkedHashMap<>();
        context.forEach((key, value) -> sanitized.put(key, isSensitive(key) ? REDACTED : sanitizeValue(value)));
        return sanitized;
    }

    /**
     * Sanitize a single value: strings are truncated, maps and collections are sanitized recursively.
     */
    public Object sanitizeValue(Object value) {
        if (value instanceof String) {
            String text = (String) value;
            return text.length() > MAX_STRING_LENGTH
                    ? text.substring(0, MAX_STRING_LENGTH) + TRUNCATED_SUFFIX
                    : text;
        }
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, nestedValue) -> nested.put(String.valueOf(key), nestedValue));
            return sanitize(nested);
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(sanitizeValue(item));
            }
            return items;
        }
        return value;
    }

    private static boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEY_FRAGMENTS.stream().anyMatch(normalized::contains);
    }
}
