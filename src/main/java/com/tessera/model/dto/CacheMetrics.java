package com.tessera.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time counters of a cache layer, or of all layers combined.
 */
@Value
@Builder
public class CacheMetrics {

    long hits;
    long misses;
    long evictions;
    long entryCount;

    /**
     * Estimated bytes held by live entries.
     */
    long memoryUsage;

    /**
     * Hit rate derived from the hit and miss totals (0.0-1.0).
     */
    @JsonProperty("hitRate")
    public double getHitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    public long getLookups() {
        return hits + misses;
    }

    public static CacheMetrics empty() {
        return CacheMetrics.builder().build();
    }

    /**
     * Sum of two snapshots; the hit rate of the result follows from the summed totals.
     */
    public CacheMetrics plus(CacheMetrics other) {
        return CacheMetrics.builder()
                .hits(hits + other.hits)
                .misses(misses + other.misses)
                .evictions(evictions + other.evictions)
                .entryCount(entryCount + other.entryCount)
                .memoryUsage(memoryUsage + other.memoryUsage)
                .build();
    }
}
