package com.tessera.service.error;

import java.util.Map;

/**
 * Call rejected by the circuit breaker of the service, either open or out of half-open probes.
 */
public class CircuitOpenException extends ToolException {

    public CircuitOpenException(String serviceName, CircuitState state, long retryAfterMs) {
        super("Service " + serviceName + " is currently unavailable (circuit breaker " + state + ")",
                ErrorCategory.EXTERNAL,
                ErrorSeverity.HIGH,
                serviceName,
                "circuit-breaker",
                Map.of("circuitState", state.name(), "retryAfterMs", retryAfterMs),
                null);
    }
}
