package com.tessera.model.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Aggregated health of all cache layers.
 */
@Value
@Builder
public class CacheHealthStatus {

    Status status;
    long totalMemoryUsage;
    long totalMemoryLimit;
    long totalEntries;

    /**
     * Hit rate over every lookup of every layer (0.0-1.0).
     */
    double overallHitRate;

    /**
     * Per-layer details keyed by layer id.
     */
    Map<String, LayerStatus> layerStatus;

    public enum Status {
        HEALTHY,
        DEGRADED,
        CRITICAL
    }

    @Value
    @Builder
    public static class LayerStatus {
        double hitRate;
        long memoryUsage;
        long memoryLimit;
        long entryCount;
        long entryLimit;
        long evictions;
    }
}
