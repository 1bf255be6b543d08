package com.tessera.model;

import com.tessera.service.metrics.ExecutionStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Successful answer of a tool invocation, possibly from cache or a fallback.
 */
@Value
@Builder
public class ToolResult<O> {
    O value;

    /**
     * SUCCESS, CACHED, DEGRADED or PARTIAL.
     */
    ExecutionStatus status;

    boolean cacheHit;

    /**
     * Strategy that produced the value when the primary execution failed.
     */
    FallbackStrategy fallbackStrategy;

    long durationMs;
    String sessionId;
    String traceId;
}
