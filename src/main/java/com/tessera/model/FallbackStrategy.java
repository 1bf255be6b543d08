package com.tessera.model;

/**
 * Ways of answering a call whose primary execution failed.
 */
public enum FallbackStrategy {

    /**
     * Last cached value, even if it has expired.
     */
    CACHE,

    /**
     * Cheaper variant of the operation.
     */
    SIMPLIFIED,

    /**
     * Incomplete result from whatever could be computed.
     */
    PARTIAL,

    /**
     * Static default value.
     */
    DEFAULT,

    /**
     * No fallback; ends the chain.
     */
    FAIL
}
