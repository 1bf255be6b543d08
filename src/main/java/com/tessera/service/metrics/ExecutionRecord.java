package com.tessera.service.metrics;

import com.tessera.model.ToolContext;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable history entry of a finished invocation.
 */
@Value
@Builder
public class ExecutionRecord {
    String toolName;
    ExecutionStatus status;
    ToolContext context;
    ExecutionMetrics metrics;
    String errorMessage;
}
