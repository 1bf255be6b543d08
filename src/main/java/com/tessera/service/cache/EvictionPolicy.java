package com.tessera.service.cache;

/**
 * Victim selection used when a cache layer exceeds its entry or memory budget.
 */
public enum EvictionPolicy {

    /**
     * Least recently accessed entry first.
     */
    LRU,

    /**
     * Least frequently accessed entry first, ties broken by recency.
     */
    LFU,

    /**
     * Expired entries first, then the entry closest to expiry.
     */
    TTL
}
