package com.tessera.model.dto;

import com.tessera.service.error.ErrorCategory;
import com.tessera.service.error.ErrorSeverity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Caller-facing description of a failed tool invocation.
 */
@Value
@Builder
public class StandardizedError {

    /**
     * Stable code, e.g. {@code TOOL_RATELIMIT_MEDIUM}.
     */
    String code;
    String message;
    ErrorCategory category;
    ErrorSeverity severity;
    String toolName;
    String operation;
    Instant timestamp;
    String requestId;
    List<String> suggestions;

    /**
     * Error context with secrets redacted and long values truncated.
     */
    Map<String, Object> sanitizedContext;
}
