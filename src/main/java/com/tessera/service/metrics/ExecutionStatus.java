package com.tessera.service.metrics;

public enum ExecutionStatus {
    SUCCESS,
    FAILURE,
    PARTIAL,
    CACHED,
    DEGRADED;

    /**
     * Whether the caller received a usable value.
     */
    public boolean isSuccessful() {
        return this != FAILURE;
    }
}
