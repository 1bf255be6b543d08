package com.tessera.service.cache;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Budget and expiry settings of one cache layer.
 */
@Value
@Builder(toBuilder = true)
public class CacheLayerConfig {

    /**
     * Maximum number of entries kept in the layer.
     */
    int maxEntries;

    /**
     * TTL applied when {@code set} is called without an override. {@code null} means entries never expire.
     */
    Duration defaultTtl;

    /**
     * Maximum estimated memory of all entries in the layer.
     */
    long maxMemoryBytes;

    EvictionPolicy evictionPolicy;
}
