package com.tessera.service.metrics;

import com.tessera.model.ToolContext;

import java.util.List;
import java.util.Map;

/**
 * Sink for tool execution events.
 */
public interface ExecutionLogger {

    /**
     * Record the start of an invocation.
     *
     * @return metrics to be filled in and passed back on completion
     */
    ExecutionMetrics logStart(ToolContext context);

    void logComplete(ToolContext context, ExecutionMetrics metrics, ExecutionStatus status, Object result);

    void logError(ToolContext context, ExecutionMetrics metrics, Throwable error);

    void logWarning(ToolContext context, String message, Map<String, Object> details);

    AggregatedMetrics getMetrics(String toolName);

    Map<String, AggregatedMetrics> getAllMetrics();

    /**
     * Most recent records first.
     *
     * @param toolName restrict to one tool, or null for all
     */
    List<ExecutionRecord> getExecutionHistory(String toolName, int limit);

    void reset();
}
