package com.tessera.model.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of pre-populating a cache layer.
 */
@Value
@Builder
public class CacheWarmupResult {

    String layer;
    int requestedKeys;
    int warmedKeys;
    long durationMs;

    /**
     * One message per key that could not be loaded or stored.
     */
    List<String> errors;

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
