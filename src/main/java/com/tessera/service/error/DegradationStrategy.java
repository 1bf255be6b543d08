package com.tessera.service.error;

/**
 * How a caller is expected to degrade when a failure of a given category occurs.
 */
public enum DegradationStrategy {

    /**
     * Fail immediately, nothing to gain from trying again.
     */
    FAIL,

    /**
     * Retry with exponential backoff.
     */
    RETRY,

    /**
     * Use fallback data or a cheaper operation.
     */
    FALLBACK,

    /**
     * Let the circuit breaker shed load.
     */
    CIRCUIT,

    /**
     * Serve cached data if available.
     */
    CACHE,

    /**
     * Return partial results.
     */
    PARTIAL
}
