package com.tessera.service.cache;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;

/**
 * Named partitions of the tool cache.
 *
 * Each layer owns its own entries, default TTL and counters, so the same key
 * in two layers refers to two unrelated entries.
 */
public enum CacheLayer {

    PROJECT_ANALYSIS("project_analysis", Duration.ofMinutes(10), 100, 50, EvictionPolicy.LRU),
    TEMPLATE_COMPILATION("template_compilation", null, 500, 100, EvictionPolicy.LFU),
    CONFIGURATION("configuration", Duration.ofMinutes(5), 50, 10, EvictionPolicy.TTL),
    COVERAGE("coverage", Duration.ofMinutes(5), 200, 30, EvictionPolicy.LRU),
    DEPENDENCIES("dependencies", Duration.ofMinutes(30), 100, 20, EvictionPolicy.LRU),
    TEST_GENERATION("test_generation", Duration.ofMinutes(15), 150, 40, EvictionPolicy.LRU),
    TEST_EXECUTION("test_execution", Duration.ofMinutes(5), 100, 25, EvictionPolicy.LRU);

    private static final long MEGABYTE = 1024L * 1024L;

    private final String id;
    private final Duration defaultTtl;
    private final int defaultMaxEntries;
    private final long defaultMaxMemoryBytes;
    private final EvictionPolicy defaultEvictionPolicy;

    CacheLayer(String id, Duration defaultTtl, int defaultMaxEntries, int defaultMaxMemoryMb,
               EvictionPolicy defaultEvictionPolicy) {
        this.id = id;
        this.defaultTtl = defaultTtl;
        this.defaultMaxEntries = defaultMaxEntries;
        this.defaultMaxMemoryBytes = defaultMaxMemoryMb * MEGABYTE;
        this.defaultEvictionPolicy = defaultEvictionPolicy;
    }

    public String getId() {
        return id;
    }

    /**
     * Built-in configuration for this layer, before any property overrides.
     */
    public CacheLayerConfig defaultConfig() {
        return CacheLayerConfig.builder()
                .maxEntries(defaultMaxEntries)
                .defaultTtl(defaultTtl)
                .maxMemoryBytes(defaultMaxMemoryBytes)
                .evictionPolicy(defaultEvictionPolicy)
                .build();
    }

    /**
     * Resolve a layer from its id, enum name or kebab-case form
     * ("project_analysis", "PROJECT_ANALYSIS", "project-analysis").
     *
     * @throws IllegalArgumentException if no layer matches
     */
    public static CacheLayer fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Cache layer must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(layer -> layer.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cache layer: " + value));
    }
}
