package com.tessera.model.dto;

import com.tessera.service.error.CircuitState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one circuit breaker.
 */
@Value
@Builder
public class CircuitBreakerState {
    String serviceName;
    CircuitState state;
    int consecutiveFailures;
    Instant lastFailureTime;
    int halfOpenProbesUsed;

    /**
     * When an open breaker will admit the next probe; null unless open.
     */
    Instant nextAttemptTime;
}
