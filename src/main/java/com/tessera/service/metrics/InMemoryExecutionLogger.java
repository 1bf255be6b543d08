package com.tessera.service.metrics;

import com.tessera.model.ToolContext;
import com.tessera.service.error.ContextSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Execution logger that writes through SLF4J and keeps a bounded in-memory
 * history plus per-tool totals.
 *
 * Each tool logs under its own category, {@code tool.<name>}, so levels can be
 * tuned per tool. Parameters kept in the history are sanitized first.
 */
@Slf4j
public class InMemoryExecutionLogger implements ExecutionLogger {

    public static final int DEFAULT_HISTORY_SIZE = 10_000;

    private final Clock clock;
    private final int maxHistorySize;
    private final ContextSanitizer sanitizer;
    private final Deque<ExecutionRecord> history = new ArrayDeque<>();
    private final Map<String, ToolTotals> totals = new ConcurrentHashMap<>();

    public InMemoryExecutionLogger(Clock clock) {
        this(clock, DEFAULT_HISTORY_SIZE);
    }

    public InMemoryExecutionLogger(Clock clock, int maxHistorySize) {
        this(clock, maxHistorySize, new ContextSanitizer());
    }

    public InMemoryExecutionLogger(Clock clock, int maxHistorySize, ContextSanitizer sanitizer) {
        this.clock = clock;
        this.maxHistorySize = maxHistorySize;
        this.sanitizer = sanitizer;
    }

    @Override
    public ExecutionMetrics logStart(ToolContext context) {
        toolLogger(context).debug("Starting {} (session={}, trace={})",
                context.getOperation(), context.getSessionId(), context.getTraceId());
        return ExecutionMetrics.startedAt(clock.instant());
    }

    @Override
    public void logComplete(ToolContext context, ExecutionMetrics metrics, ExecutionStatus status, Object result) {
        metrics.complete(clock.instant());
        boolean cacheHit = status == ExecutionStatus.CACHED || Boolean.TRUE.equals(metrics.getCacheHit());
        totals(context).record(status, metrics.getDurationMs(), cacheHit);
        append(context, metrics, status, null);

        Logger logger = toolLogger(context);
        if (status == ExecutionStatus.DEGRADED || status == ExecutionStatus.PARTIAL) {
            logger.warn("Completed {} with status {} in {}ms (trace={})",
                    context.getOperation(), status, metrics.getDurationMs(), context.getTraceId());
        } else {
            logger.info("Completed {} with status {} in {}ms, retries={} (trace={})",
                    context.getOperation(), status, metrics.getDurationMs(), metrics.getRetryCount(),
                    context.getTraceId());
        }
    }

    @Override
    public void logError(ToolContext context, ExecutionMetrics metrics, Throwable error) {
        metrics.incrementErrorCount();
        metrics.complete(clock.instant());
        totals(context).record(ExecutionStatus.FAILURE, metrics.getDurationMs(), false);
        append(context, metrics, ExecutionStatus.FAILURE, error.getMessage());

        toolLogger(context).error("Failed {} after {}ms, retries={} (trace={}): {}",
                context.getOperation(), metrics.getDurationMs(), metrics.getRetryCount(),
                context.getTraceId(), error.getMessage());
    }

    @Override
    public void logWarning(ToolContext context, String message, Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            toolLogger(context).warn("{} (trace={})", message, context.getTraceId());
        } else {
            toolLogger(context).warn("{} {} (trace={})", message, details, context.getTraceId());
        }
    }

    @Override
    public AggregatedMetrics getMetrics(String toolName) {
        ToolTotals toolTotals = totals.get(toolName);
        return toolTotals == null ? AggregatedMetrics.empty(toolName) : toolTotals.toMetrics(toolName);
    }

    @Override
    public Map<String, AggregatedMetrics> getAllMetrics() {
        Map<String, AggregatedMetrics> all = new TreeMap<>();
        totals.forEach((name, toolTotals) -> all.put(name, toolTotals.toMetrics(name)));
        return all;
    }

    @Override
    public List<ExecutionRecord> getExecutionHistory(String toolName, int limit) {
        List<ExecutionRecord> records = new ArrayList<>();
        synchronized (history) {
            Iterator<ExecutionRecord> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && records.size() < limit) {
                ExecutionRecord record = newestFirst.next();
                if (toolName == null || toolName.equals(record.getToolName())) {
                    records.add(record);
                }
            }
        }
        return records;
    }

    @Override
    public void reset() {
        synchronized (history) {
            history.clear();
        }
        totals.clear();
        log.info("Execution metrics reset");
    }

    private void append(ToolContext context, ExecutionMetrics metrics, ExecutionStatus status, String errorMessage) {
        ExecutionRecord record = ExecutionRecord.builder()
                .toolName(context.getToolName())
                .status(status)
                .context(context.toBuilder()
                        .parameters(sanitizer.sanitizeValue(context.getParameters()))
                        .build())
                .metrics(metrics.snapshot())
                .errorMessage(errorMessage)
                .build();
        synchronized (history) {
            history.addLast(record);
            while (history.size() > maxHistorySize) {
                history.removeFirst();
            }
        }
    }

    private ToolTotals totals(ToolContext context) {
        return totals.computeIfAbsent(context.getToolName(), name -> new ToolTotals());
    }

    private static Logger toolLogger(ToolContext context) {
        return LoggerFactory.getLogger("tool." + context.getToolName());
    }

    private static final class ToolTotals {
        private final AtomicLong executions = new AtomicLong();
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private final AtomicLong cacheHits = new AtomicLong();
        private final AtomicLong totalDurationMs = new AtomicLong();

        void record(ExecutionStatus status, Long durationMs, boolean cacheHit) {
            executions.incrementAndGet();
            if (status.isSuccessful()) {
                successes.incrementAndGet();
            } else {
                failures.incrementAndGet();
            }
            if (cacheHit) {
                cacheHits.incrementAndGet();
            }
            if (durationMs != null) {
                totalDurationMs.addAndGet(durationMs);
            }
        }

        AggregatedMetrics toMetrics(String toolName) {
            long total = executions.get();
            return AggregatedMetrics.builder()
                    .toolName(toolName)
                    .totalExecutions(total)
                    .successCount(successes.get())
                    .failureCount(failures.get())
                    .cacheHits(cacheHits.get())
                    .averageDurationMs(ratio(totalDurationMs.get(), total))
                    .successRate(ratio(successes.get(), total))
                    .cacheHitRate(ratio(cacheHits.get(), total))
                    .errorRate(ratio(failures.get(), total))
                    .build();
        }

        private static double ratio(long value, long total) {
            return total == 0 ? 0.0 : (double) value / total;
        }
    }
}
