package com.tessera.controller;

import com.tessera.model.dto.CircuitBreakerState;
import com.tessera.service.error.ToolErrorHandler;
import com.tessera.service.metrics.AggregatedMetrics;
import com.tessera.service.metrics.ExecutionLogger;
import com.tessera.service.metrics.ExecutionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Admin API for circuit breakers and execution metrics.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    static final int MAX_HISTORY_LIMIT = 1000;

    private final ToolErrorHandler errorHandler;
    private final ExecutionLogger executionLogger;

    public AdminController(ToolErrorHandler errorHandler, ExecutionLogger executionLogger) {
        this.errorHandler = errorHandler;
        this.executionLogger = executionLogger;
    }

    /**
     * Get the state of every circuit breaker created so far.
     */
    @GetMapping("/circuit-breakers")
    public ResponseEntity<Map<String, CircuitBreakerState>> getCircuitBreakers() {
        return ResponseEntity.ok(errorHandler.getCircuitBreakerStates());
    }

    /**
     * Get the state of one circuit breaker.
     *
     * @param name service (tool) name
     * @return breaker state, or 404 if the service has no breaker yet
     */
    @GetMapping("/circuit-breakers/{name}")
    public ResponseEntity<CircuitBreakerState> getCircuitBreaker(@PathVariable String name) {
        CircuitBreakerState state = errorHandler.getCircuitBreakerStates().get(name);
        return state == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(state);
    }

    /**
     * Reset a circuit breaker to CLOSED.
     *
     * @param name service (tool) name
     */
    @PostMapping("/circuit-breakers/{name}/reset")
    public ResponseEntity<Map<String, Object>> resetCircuitBreaker(@PathVariable String name) {
        log.warn("Admin: Resetting circuit breaker for {}", name);
        boolean existed = errorHandler.resetCircuitBreaker(name);

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "service", name,
                "reset", existed
        ));
    }

    /**
     * Get aggregated execution metrics.
     *
     * @param tool Restrict to one tool (optional)
     */
    @GetMapping("/metrics")
    public ResponseEntity<Map<String, AggregatedMetrics>> getMetrics(@RequestParam(required = false) String tool) {
        if (tool != null) {
            return ResponseEntity.ok(Map.of(tool, executionLogger.getMetrics(tool)));
        }
        return ResponseEntity.ok(executionLogger.getAllMetrics());
    }

    /**
     * Get recent executions, newest first.
     *
     * @param tool Restrict to one tool (optional)
     * @param limit Maximum number of records (default: 50)
     */
    @GetMapping("/history")
    public ResponseEntity<List<ExecutionRecord>> getHistory(
            @RequestParam(required = false) String tool,
            @RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return ResponseEntity.ok(executionLogger.getExecutionHistory(tool, bounded));
    }
}
