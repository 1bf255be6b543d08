package com.tessera.model;

import lombok.Builder;
import lombok.Data;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Per-invocation context of a tool call.
 *
 * Callers may set any field; missing identifiers are generated when the
 * context is resolved for a tool:
 * - sessionId: {@code <tool>-<millis>-<random>}
 * - traceId: {@code trace-<millis>-<random>}
 */
@Data
@Builder(toBuilder = true)
public class ToolContext {

    private String toolName;
    private String operation;

    /**
     * Raw parameters as received, before validation.
     */
    private Object parameters;

    private String userId;
    private String sessionId;
    private String traceId;
    private String requestId;

    /**
     * Skip the cache lookup; the result is still stored unless {@link #store} is false.
     */
    @Builder.Default
    private boolean bypassCache = false;

    /**
     * Store a fresh result in the cache.
     */
    @Builder.Default
    private boolean store = true;

    public static ToolContext defaults() {
        return ToolContext.builder().build();
    }

    /**
     * Copy of this context bound to a tool, with missing identifiers generated.
     */
    public ToolContext resolve(String tool, String defaultOperation, Object rawParameters) {
        long now = System.currentTimeMillis();
        return toBuilder()
                .toolName(tool)
                .operation(operation != null ? operation : defaultOperation)
                .parameters(parameters != null ? parameters : rawParameters)
                .sessionId(sessionId != null ? sessionId : tool + "-" + now + "-" + randomSuffix())
                .traceId(traceId != null ? traceId : "trace-" + now + "-" + randomSuffix())
                .build();
    }

    private static String randomSuffix() {
        return Integer.toString(ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE), 36);
    }
}
