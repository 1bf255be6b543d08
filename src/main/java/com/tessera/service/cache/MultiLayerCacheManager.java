package com.tessera.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.model.dto.CacheHealthStatus;
import com.tessera.model.dto.CacheMetrics;
import com.tessera.model.dto.CacheWarmupResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * In-memory, multi-layer cache shared by all tool adapters.
 *
 * Flow:
 * 1. {@code get} checks expiry lazily and counts hits/misses per layer
 * 2. {@code set} estimates the entry size from its JSON form and evicts until the layer fits its budget
 * 3. A background sweep purges expired entries every cleanup interval
 *
 * Internal faults never reach callers: a failing {@code get} is a miss, a failing {@code set} is a no-op.
 */
@Slf4j
public class MultiLayerCacheManager {

    static final double CRITICAL_MEMORY_RATIO = 0.9;
    static final double DEGRADED_CAPACITY_RATIO = 0.75;
    static final double LOW_HIT_RATE = 0.5;
    static final long MIN_LOOKUPS_FOR_HIT_RATE = 20;
    static final int DEFAULT_WARMUP_BATCH_SIZE = 5;

    private final Map<CacheLayer, CacheLayerStore> stores = new EnumMap<>(CacheLayer.class);
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration cleanupInterval;

    private ScheduledExecutorService cleanupExecutor;
    private ScheduledFuture<?> cleanupTask;

    public MultiLayerCacheManager(Map<CacheLayer, CacheLayerConfig> layerConfigs,
                                  ObjectMapper objectMapper,
                                  Clock clock,
                                  Duration cleanupInterval) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.cleanupInterval = cleanupInterval;
        for (CacheLayer layer : CacheLayer.values()) {
            CacheLayerConfig config = layerConfigs.getOrDefault(layer, layer.defaultConfig());
            stores.put(layer, new CacheLayerStore(layer, config, clock));
        }
        log.info("Initialized cache layers: {}, total memory limit={}B", stores.keySet(), getTotalMemoryLimit());
    }

    /**
     * Look up a value. Expired entries are purged and reported as a miss.
     */
    public Optional<Object> get(CacheLayer layer, String key) {
        try {
            return stores.get(layer).get(key);
        } catch (RuntimeException e) {
            log.debug("Cache get failed, treating as miss: layer={}, key={}", layer, key, e);
            return Optional.empty();
        }
    }

    /**
     * Look up a value of the expected type; a value of another type is treated as absent.
     */
    public <T> Optional<T> get(CacheLayer layer, String key, Class<T> type) {
        return get(layer, key)
                .filter(type::isInstance)
                .map(type::cast);
    }

    /**
     * Store a value with the layer default TTL.
     */
    public void set(CacheLayer layer, String key, Object value) {
        set(layer, key, value, null);
    }

    /**
     * Store a value; a null or non-positive TTL falls back to the layer default.
     */
    public void set(CacheLayer layer, String key, Object value, Duration ttl) {
        store(layer, key, value, ttl);
    }

    /**
     * Look up a value without touching hit/miss counters or access order.
     */
    public Optional<Object> peek(CacheLayer layer, String key) {
        try {
            return stores.get(layer).peek(key);
        } catch (RuntimeException e) {
            log.debug("Cache peek failed: layer={}, key={}", layer, key, e);
            return Optional.empty();
        }
    }

    /**
     * Pre-populate a layer with the default TTL and batch size.
     *
     * @see #warmup(CacheLayer, Map, Duration, int)
     */
    public CacheWarmupResult warmup(CacheLayer layer, Map<String, ? extends Supplier<?>> loaders) {
        return warmup(layer, loaders, null, DEFAULT_WARMUP_BATCH_SIZE);
    }

    /**
     * Pre-populate a layer, loading and storing keys in batches.
     *
     * A loader that throws, or a value the layer refuses, is reported in the
     * result errors; the remaining keys are still warmed.
     *
     * @param loaders   value loader per key, in the order they should be warmed
     * @param ttl       TTL of the warmed entries; null uses the layer default
     * @param batchSize keys per batch; non-positive values use the default
     */
    public CacheWarmupResult warmup(CacheLayer layer, Map<String, ? extends Supplier<?>> loaders,
                                    Duration ttl, int batchSize) {
        long start = clock.millis();
        int size = batchSize > 0 ? batchSize : DEFAULT_WARMUP_BATCH_SIZE;
        List<Map.Entry<String, ? extends Supplier<?>>> pending = new ArrayList<>(loaders.entrySet());
        List<String> errors = new ArrayList<>();
        int warmed = 0;

        log.info("Cache warmup started: layer={}, keys={}, batchSize={}", layer.getId(), pending.size(), size);
        for (int from = 0; from < pending.size(); from += size) {
            List<Map.Entry<String, ? extends Supplier<?>>> batch =
                    pending.subList(from, Math.min(from + size, pending.size()));
            for (Map.Entry<String, ? extends Supplier<?>> entry : batch) {
                String key = entry.getKey();
                Object value;
                try {
                    value = entry.getValue().get();
                } catch (RuntimeException e) {
                    errors.add("Warmup failed for key " + key + ": " + e.getMessage());
                    log.warn("Cache warmup loader failed: layer={}, key={}: {}", layer.getId(), key, e.getMessage());
                    continue;
                }
                if (store(layer, key, value, ttl)) {
                    warmed++;
                } else {
                    errors.add("Warmup failed for key " + key + ": value was not stored");
                }
            }
            log.debug("Cache warmup progress: layer={}, processed={}/{}", layer.getId(),
                    Math.min(from + size, pending.size()), pending.size());
        }

        long durationMs = clock.millis() - start;
        log.info("Cache warmup completed: layer={}, warmed={}, errors={}, duration={}ms",
                layer.getId(), warmed, errors.size(), durationMs);
        return CacheWarmupResult.builder()
                .layer(layer.getId())
                .requestedKeys(pending.size())
                .warmedKeys(warmed)
                .durationMs(durationMs)
                .errors(List.copyOf(errors))
                .build();
    }

    public void remove(CacheLayer layer, String key) {
        try {
            if (stores.get(layer).remove(key)) {
                log.debug("Cache entry removed: layer={}, key={}", layer, key);
            }
        } catch (RuntimeException e) {
            log.warn("Cache remove failed: layer={}, key={}: {}", layer, key, e.getMessage());
        }
    }

    public void clear(CacheLayer layer) {
        try {
            int cleared = stores.get(layer).clear();
            log.info("Cache layer cleared: layer={}, clearedEntries={}", layer, cleared);
        } catch (RuntimeException e) {
            log.warn("Cache clear failed: layer={}: {}", layer, e.getMessage());
        }
    }

    public void clearAll() {
        stores.keySet().forEach(this::clear);
    }

    /**
     * Remove all entries and zero every counter.
     */
    public void reset() {
        stores.values().forEach(CacheLayerStore::reset);
        log.info("Cache manager reset");
    }

    public CacheMetrics getMetrics(CacheLayer layer) {
        return stores.get(layer).metrics();
    }

    public Map<CacheLayer, CacheMetrics> getMetrics() {
        Map<CacheLayer, CacheMetrics> metrics = new EnumMap<>(CacheLayer.class);
        stores.forEach((layer, store) -> metrics.put(layer, store.metrics()));
        return Collections.unmodifiableMap(metrics);
    }

    public CacheMetrics getAggregateMetrics() {
        return stores.values().stream()
                .map(CacheLayerStore::metrics)
                .reduce(CacheMetrics.empty(), CacheMetrics::plus);
    }

    public CacheLayerConfig getLayerConfig(CacheLayer layer) {
        return stores.get(layer).getConfig();
    }

    public CacheHealthStatus getHealthStatus() {
        Map<String, CacheHealthStatus.LayerStatus> layerStatus = new LinkedHashMap<>();
        CacheMetrics total = CacheMetrics.empty();
        boolean layerDegraded = false;

        for (Map.Entry<CacheLayer, CacheLayerStore> entry : stores.entrySet()) {
            CacheLayerConfig config = entry.getValue().getConfig();
            CacheMetrics metrics = entry.getValue().metrics();
            total = total.plus(metrics);

            double memoryRatio = ratio(metrics.getMemoryUsage(), config.getMaxMemoryBytes());
            double entryRatio = ratio(metrics.getEntryCount(), config.getMaxEntries());
            boolean lowHitRate = metrics.getLookups() >= MIN_LOOKUPS_FOR_HIT_RATE
                    && metrics.getHitRate() < LOW_HIT_RATE;
            if (memoryRatio >= DEGRADED_CAPACITY_RATIO || entryRatio >= DEGRADED_CAPACITY_RATIO || lowHitRate) {
                layerDegraded = true;
            }

            layerStatus.put(entry.getKey().getId(), CacheHealthStatus.LayerStatus.builder()
                    .hitRate(metrics.getHitRate())
                    .memoryUsage(metrics.getMemoryUsage())
                    .memoryLimit(config.getMaxMemoryBytes())
                    .entryCount(metrics.getEntryCount())
                    .entryLimit(config.getMaxEntries())
                    .evictions(metrics.getEvictions())
                    .build());
        }

        long totalMemoryLimit = getTotalMemoryLimit();
        double totalMemoryRatio = ratio(total.getMemoryUsage(), totalMemoryLimit);
        boolean lowOverallHitRate = total.getLookups() >= MIN_LOOKUPS_FOR_HIT_RATE
                && total.getHitRate() < LOW_HIT_RATE;

        CacheHealthStatus.Status status = CacheHealthStatus.Status.HEALTHY;
        if (totalMemoryRatio > CRITICAL_MEMORY_RATIO) {
            status = CacheHealthStatus.Status.CRITICAL;
        } else if (layerDegraded || lowOverallHitRate) {
            status = CacheHealthStatus.Status.DEGRADED;
        }

        return CacheHealthStatus.builder()
                .status(status)
                .totalMemoryUsage(total.getMemoryUsage())
                .totalMemoryLimit(totalMemoryLimit)
                .totalEntries(total.getEntryCount())
                .overallHitRate(total.getHitRate())
                .layerStatus(layerStatus)
                .build();
    }

    /**
     * Purge expired entries across all layers.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        int purged = 0;
        for (Map.Entry<CacheLayer, CacheLayerStore> entry : stores.entrySet()) {
            int removed = entry.getValue().purgeExpired();
            if (removed > 0) {
                log.debug("Purged expired entries: layer={}, purged={}", entry.getKey(), removed);
            }
            purged += removed;
        }
        return purged;
    }

    /**
     * Start the periodic expiry sweep. Calling it twice has no effect.
     */
    public synchronized void start() {
        if (cleanupExecutor != null) {
            return;
        }
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cache-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = cleanupInterval.toMillis();
        cleanupTask = cleanupExecutor.scheduleAtFixedRate(this::runCleanup, intervalMs, intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Cache cleanup scheduled every {}", cleanupInterval);
    }

    /**
     * Stop the expiry sweep and release its thread.
     */
    public synchronized void stop() {
        if (cleanupExecutor == null) {
            return;
        }
        cleanupTask.cancel(false);
        cleanupExecutor.shutdownNow();
        cleanupExecutor = null;
        cleanupTask = null;
        log.info("Cache cleanup stopped");
    }

    public synchronized boolean isRunning() {
        return cleanupExecutor != null;
    }

    private void runCleanup() {
        try {
            purgeExpired();
        } catch (RuntimeException e) {
            log.warn("Cache cleanup sweep failed", e);
        }
    }

    private boolean store(CacheLayer layer, String key, Object value, Duration ttl) {
        try {
            long size = estimateSize(value);
            return stores.get(layer).put(key, value, ttl, size);
        } catch (JsonProcessingException e) {
            log.debug("Cache set skipped, value not serializable: layer={}, key={}", layer, key, e);
        } catch (RuntimeException e) {
            log.warn("Cache set failed: layer={}, key={}: {}", layer, key, e.getMessage());
        }
        return false;
    }

    private long estimateSize(Object value) throws JsonProcessingException {
        if (value == null) {
            return 0;
        }
        return objectMapper.writeValueAsBytes(value).length;
    }

    private long getTotalMemoryLimit() {
        return stores.values().stream()
                .mapToLong(store -> store.getConfig().getMaxMemoryBytes())
                .sum();
    }

    private static double ratio(long value, long limit) {
        return limit <= 0 ? 0.0 : (double) value / limit;
    }
}
