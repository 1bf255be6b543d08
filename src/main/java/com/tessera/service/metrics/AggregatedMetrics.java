package com.tessera.service.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Running totals for one tool.
 */
@Value
@Builder
public class AggregatedMetrics {
    String toolName;
    long totalExecutions;
    long successCount;
    long failureCount;
    long cacheHits;
    double averageDurationMs;
    double successRate;
    double cacheHitRate;
    double errorRate;

    public static AggregatedMetrics empty(String toolName) {
        return AggregatedMetrics.builder().toolName(toolName).build();
    }
}
