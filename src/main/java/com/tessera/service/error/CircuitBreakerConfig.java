package com.tessera.service.error;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Thresholds shared by every circuit breaker of a registry.
 */
@Value
@Builder
public class CircuitBreakerConfig {

    /**
     * Consecutive failures that open a closed breaker.
     */
    @Builder.Default
    int failureThreshold = 5;

    /**
     * How long an open breaker rejects calls before admitting probes.
     */
    @Builder.Default
    Duration recoveryTimeout = Duration.ofSeconds(60);

    /**
     * Probe calls admitted while half-open.
     */
    @Builder.Default
    int halfOpenMaxCalls = 3;

    public static CircuitBreakerConfig defaults() {
        return CircuitBreakerConfig.builder().build();
    }
}
