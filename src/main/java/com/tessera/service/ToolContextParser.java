package com.tessera.service;

import com.tessera.model.ToolContext;
import com.tessera.model.ToolHeaders;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Builds the invocation context of a tool call from request headers.
 *
 * Supported headers:
 * - x-session-id, x-trace-id, x-request-id, x-user-id: caller identifiers
 * - x-cache-bypass: skip cache lookup
 * - x-cache-store: control result storage
 */
@Slf4j
@Service
public class ToolContextParser {

    /**
     * Parse tool context from HTTP headers.
     *
     * @param headers HTTP request headers
     * @return parsed context (never null); missing identifiers are generated later
     */
    public ToolContext parse(HttpHeaders headers) {
        ToolContext.ToolContextBuilder builder = ToolContext.builder()
                .sessionId(trimmed(headers.getFirst(ToolHeaders.SESSION_ID)))
                .traceId(trimmed(headers.getFirst(ToolHeaders.TRACE_ID)))
                .requestId(trimmed(headers.getFirst(ToolHeaders.REQUEST_ID)))
                .userId(trimmed(headers.getFirst(ToolHeaders.USER_ID)));

        String bypass = headers.getFirst(ToolHeaders.CACHE_BYPASS);
        if (bypass != null) {
            boolean bypassCache = parseBoolean(bypass, false);
            builder.bypassCache(bypassCache);
            if (bypassCache) {
                log.debug("Cache bypass requested via header");
            }
        }

        String store = headers.getFirst(ToolHeaders.CACHE_STORE);
        if (store != null) {
            boolean storeResult = parseBoolean(store, true);
            builder.store(storeResult);
            if (!storeResult) {
                log.debug("Cache storage disabled via header");
            }
        }

        return builder.build();
    }

    /**
     * Parse boolean from string.
     * Accepts: true/false, 1/0, yes/no, on/off (case-insensitive)
     */
    private boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        String normalized = value.trim().toLowerCase();

        return switch (normalized) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> {
                log.warn("Invalid boolean value: {}, using default: {}", value, defaultValue);
                yield defaultValue;
            }
        };
    }

    private static String trimmed(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
