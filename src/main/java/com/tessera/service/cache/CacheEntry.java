package com.tessera.service.cache;

import lombok.Getter;

import java.time.Instant;

/**
 * A value stored in a cache layer together with its expiry and access bookkeeping.
 *
 * Access fields are only mutated while the owning layer holds its lock.
 */
@Getter
public class CacheEntry {

    private final String key;
    private final Object value;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final long approximateSizeBytes;
    private Instant lastAccessedAt;
    private long accessSequence;
    private long accessCount;

    CacheEntry(String key, Object value, Instant createdAt, Instant expiresAt, long approximateSizeBytes,
               long sequence) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.approximateSizeBytes = approximateSizeBytes;
        this.lastAccessedAt = createdAt;
        this.accessSequence = sequence;
        this.accessCount = 1;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    void recordAccess(Instant now, long sequence) {
        accessCount++;
        lastAccessedAt = now;
        accessSequence = sequence;
    }
}
