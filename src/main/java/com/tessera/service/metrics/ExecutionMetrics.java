package com.tessera.service.metrics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable measurements of one invocation, filled in while it runs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionMetrics {
    private Instant startTime;
    private Instant endTime;
    private Long durationMs;
    private Boolean cacheHit;
    private int retryCount;
    private int errorCount;

    public static ExecutionMetrics startedAt(Instant startTime) {
        return ExecutionMetrics.builder().startTime(startTime).build();
    }

    public void complete(Instant end) {
        this.endTime = end;
        this.durationMs = Math.max(0, Duration.between(startTime, end).toMillis());
    }

    public synchronized void incrementRetryCount() {
        retryCount++;
    }

    public synchronized void incrementErrorCount() {
        errorCount++;
    }

    public ExecutionMetrics snapshot() {
        return toBuilder().build();
    }
}
