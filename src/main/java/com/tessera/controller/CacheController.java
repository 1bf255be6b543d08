package com.tessera.controller;

import com.tessera.model.dto.CacheHealthStatus;
import com.tessera.model.dto.CacheMetrics;
import com.tessera.model.dto.CacheWarmupResult;
import com.tessera.service.cache.CacheLayer;
import com.tessera.service.cache.MultiLayerCacheManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Cache management controller.
 * Provides statistics, health, warmup and invalidation for the cache layers.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final MultiLayerCacheManager cacheManager;

    public CacheController(MultiLayerCacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    /**
     * Get per-layer and aggregate statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, CacheMetrics> layers = new LinkedHashMap<>();
        cacheManager.getMetrics().forEach((layer, metrics) -> layers.put(layer.getId(), metrics));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("aggregate", cacheManager.getAggregateMetrics());
        body.put("layers", layers);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats/{layer}")
    public ResponseEntity<CacheMetrics> getLayerStats(@PathVariable String layer) {
        return ResponseEntity.ok(cacheManager.getMetrics(CacheLayer.fromId(layer)));
    }

    @GetMapping("/health")
    public ResponseEntity<CacheHealthStatus> getHealth() {
        return ResponseEntity.ok(cacheManager.getHealthStatus());
    }

    /**
     * Remove every entry of one layer. Counters are kept.
     */
    @PostMapping("/{layer}/clear")
    public ResponseEntity<Map<String, String>> clearLayer(@PathVariable String layer) {
        CacheLayer cacheLayer = CacheLayer.fromId(layer);
        log.info("Cache clear requested for layer {}", cacheLayer.getId());
        cacheManager.clear(cacheLayer);

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Cache layer cleared: " + cacheLayer.getId()
        ));
    }

    /**
     * Pre-populate one layer with the given key/value pairs.
     */
    @PostMapping("/{layer}/warmup")
    public ResponseEntity<CacheWarmupResult> warmupLayer(
            @PathVariable String layer,
            @RequestBody Map<String, Object> entries,
            @RequestParam(required = false) Long ttlSeconds,
            @RequestParam(defaultValue = "5") int batchSize) {
        CacheLayer cacheLayer = CacheLayer.fromId(layer);
        log.info("Cache warmup requested: layer={}, keys={}", cacheLayer.getId(), entries.size());

        Map<String, Supplier<Object>> loaders = new LinkedHashMap<>();
        entries.forEach((key, value) -> loaders.put(key, () -> value));
        Duration ttl = ttlSeconds == null ? null : Duration.ofSeconds(ttlSeconds);

        return ResponseEntity.ok(cacheManager.warmup(cacheLayer, loaders, ttl, batchSize));
    }

    @DeleteMapping("/{layer}/{key}")
    public ResponseEntity<Void> removeEntry(@PathVariable String layer, @PathVariable String key) {
        CacheLayer cacheLayer = CacheLayer.fromId(layer);
        log.info("Cache entry removal requested: layer={}, key={}", cacheLayer.getId(), key);
        cacheManager.remove(cacheLayer, key);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleUnknownLayer(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "status", "error",
                "message", e.getMessage()
        ));
    }
}
