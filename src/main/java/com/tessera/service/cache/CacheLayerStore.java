package com.tessera.service.cache;

import com.tessera.model.dto.CacheMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entries, budget enforcement and counters of a single cache layer.
 *
 * All map access happens under one lock per layer; counters are atomics so
 * metrics can be read without taking the lock.
 */
@Slf4j
class CacheLayerStore {

    private static final Comparator<CacheEntry> LEAST_RECENTLY_USED =
            Comparator.comparingLong(CacheEntry::getAccessSequence);

    private static final Comparator<CacheEntry> LEAST_FREQUENTLY_USED = Comparator
            .comparingLong(CacheEntry::getAccessCount)
            .thenComparing(LEAST_RECENTLY_USED);

    private final CacheLayer layer;
    private final CacheLayerConfig config;
    private final Clock clock;
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong memoryUsage = new AtomicLong();
    private final AtomicLong entryCount = new AtomicLong();

    CacheLayerStore(CacheLayer layer, CacheLayerConfig config, Clock clock) {
        this.layer = layer;
        this.config = config;
        this.clock = clock;
    }

    CacheLayerConfig getConfig() {
        return config;
    }

    Optional<Object> get(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses.incrementAndGet();
                log.debug("Cache miss: layer={}, key={}", layer.getId(), key);
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                removeEntry(key);
                misses.incrementAndGet();
                log.debug("Cache miss (expired): layer={}, key={}", layer.getId(), key);
                return Optional.empty();
            }
            entry.recordAccess(now, sequence.incrementAndGet());
            hits.incrementAndGet();
            log.debug("Cache hit: layer={}, key={}, accessCount={}", layer.getId(), key, entry.getAccessCount());
            return Optional.ofNullable(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read a live value without counting a lookup or recording an access.
     */
    Optional<Object> peek(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.ofNullable(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a value and evict until the layer is back within budget.
     *
     * @return false if the value alone exceeds the layer memory budget and was not stored
     */
    boolean put(String key, Object value, Duration ttlOverride, long sizeBytes) {
        if (sizeBytes > config.getMaxMemoryBytes()) {
            log.warn("Value too large for cache layer {}: key={}, size={}B, budget={}B",
                    layer.getId(), key, sizeBytes, config.getMaxMemoryBytes());
            return false;
        }

        Instant now = clock.instant();
        Duration ttl = ttlOverride != null && !ttlOverride.isNegative() && !ttlOverride.isZero()
                ? ttlOverride
                : config.getDefaultTtl();
        Instant expiresAt = ttl == null ? null : now.plus(ttl);
        CacheEntry entry = new CacheEntry(key, value, now, expiresAt, sizeBytes, sequence.incrementAndGet());

        lock.lock();
        try {
            removeEntry(key);
            entries.put(key, entry);
            entryCount.incrementAndGet();
            memoryUsage.addAndGet(sizeBytes);
            evictWhileOverBudget(key, now);
        } finally {
            lock.unlock();
        }

        log.debug("Cache set: layer={}, key={}, size={}B, ttl={}", layer.getId(), key, sizeBytes, ttl);
        return true;
    }

    boolean remove(String key) {
        lock.lock();
        try {
            return removeEntry(key);
        } finally {
            lock.unlock();
        }
    }

    int clear() {
        lock.lock();
        try {
            int cleared = entries.size();
            entries.clear();
            entryCount.set(0);
            memoryUsage.set(0);
            return cleared;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop entries and counters.
     */
    void reset() {
        lock.lock();
        try {
            clear();
            hits.set(0);
            misses.set(0);
            evictions.set(0);
        } finally {
            lock.unlock();
        }
    }

    int purgeExpired() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int purged = 0;
            Iterator<Map.Entry<String, CacheEntry>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                CacheEntry entry = iterator.next().getValue();
                if (entry.isExpired(now)) {
                    iterator.remove();
                    entryCount.decrementAndGet();
                    memoryUsage.addAndGet(-entry.getApproximateSizeBytes());
                    purged++;
                }
            }
            return purged;
        } finally {
            lock.unlock();
        }
    }

    CacheMetrics metrics() {
        return CacheMetrics.builder()
                .hits(hits.get())
                .misses(misses.get())
                .evictions(evictions.get())
                .entryCount(entryCount.get())
                .memoryUsage(memoryUsage.get())
                .build();
    }

    private boolean removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        entryCount.decrementAndGet();
        memoryUsage.addAndGet(-removed.getApproximateSizeBytes());
        return true;
    }

    private boolean isOverBudget() {
        return entries.size() > config.getMaxEntries() || memoryUsage.get() > config.getMaxMemoryBytes();
    }

    private void evictWhileOverBudget(String protectedKey, Instant now) {
        int evicted = 0;
        while (isOverBudget() && entries.size() > 1) {
            Optional<CacheEntry> victim = selectVictim(protectedKey, now);
            if (victim.isEmpty()) {
                break;
            }
            removeEntry(victim.get().getKey());
            evictions.incrementAndGet();
            evicted++;
        }
        if (evicted > 0) {
            log.debug("Evicted entries: layer={}, policy={}, evicted={}, remaining={}",
                    layer.getId(), config.getEvictionPolicy(), evicted, entries.size());
        }
    }

    private Optional<CacheEntry> selectVictim(String protectedKey, Instant now) {
        return entries.values().stream()
                .filter(entry -> !entry.getKey().equals(protectedKey))
                .min(victimOrder(now));
    }

    private Comparator<CacheEntry> victimOrder(Instant now) {
        switch (config.getEvictionPolicy()) {
            case LFU:
                return LEAST_FREQUENTLY_USED;
            case TTL:
                return Comparator
                        .comparing((CacheEntry entry) -> !entry.isExpired(now))
                        .thenComparing(CacheEntry::getExpiresAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(LEAST_RECENTLY_USED);
            case LRU:
            default:
                return LEAST_RECENTLY_USED;
        }
    }
}
