package com.tessera.tool;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tessera.model.FallbackConfig;
import com.tessera.model.FallbackStrategy;
import com.tessera.model.HealthReport;
import com.tessera.model.ToolContext;
import com.tessera.model.ToolResult;
import com.tessera.model.dto.ErrorResponse;
import com.tessera.service.cache.MultiLayerCacheManager;
import com.tessera.service.error.ErrorCategory;
import com.tessera.service.error.FallbackFailedException;
import com.tessera.service.error.OperationTimeoutException;
import com.tessera.service.error.RetryPolicy;
import com.tessera.service.error.ToolErrorHandler;
import com.tessera.service.error.ToolException;
import com.tessera.service.error.ToolFailureException;
import com.tessera.service.metrics.ExecutionLogger;
import com.tessera.service.metrics.ExecutionMetrics;
import com.tessera.service.metrics.ExecutionStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link ToolOperation} with caching, retries, circuit breaking and fallbacks.
 *
 * Flow of {@link #execute(Object, ToolContext)}:
 * 1. Validate input; invalid input fails at once
 * 2. Return the cached result if present
 * 3. On miss: retry( circuit-breaker( timeout(core) ) )
 * 4. On success: store in the cache layer and the last-known-good store
 * 5. On failure: walk the fallback chain, else fail with a {@link ToolFailureException}
 *
 * Cache and logging faults are logged and never change the outcome.
 */
@Slf4j
public class ResilientToolAdapter<I, O> {

    static final int DEFAULT_LAST_KNOWN_GOOD_SIZE = 256;
    private static final String EXECUTE = "execute";

    private final ToolOperation<I, O> operation;
    private final FallbackConfig fallbackConfig;
    private final MultiLayerCacheManager cacheManager;
    private final ToolErrorHandler errorHandler;
    private final ExecutionLogger executionLogger;
    private final Clock clock;
    private final Cache<String, O> lastKnownGood;

    public ResilientToolAdapter(ToolOperation<I, O> operation,
                                FallbackConfig fallbackConfig,
                                MultiLayerCacheManager cacheManager,
                                ToolErrorHandler errorHandler,
                                ExecutionLogger executionLogger,
                                Clock clock) {
        this(operation, fallbackConfig, cacheManager, errorHandler, executionLogger, clock,
                DEFAULT_LAST_KNOWN_GOOD_SIZE);
    }

    public ResilientToolAdapter(ToolOperation<I, O> operation,
                                FallbackConfig fallbackConfig,
                                MultiLayerCacheManager cacheManager,
                                ToolErrorHandler errorHandler,
                                ExecutionLogger executionLogger,
                                Clock clock,
                                int lastKnownGoodSize) {
        this.operation = operation;
        this.fallbackConfig = fallbackConfig;
        this.cacheManager = cacheManager;
        this.errorHandler = errorHandler;
        this.executionLogger = executionLogger;
        this.clock = clock;
        this.lastKnownGood = Caffeine.newBuilder()
                .maximumSize(lastKnownGoodSize)
                .build();
    }

    public String getName() {
        return operation.getName();
    }

    public String getDescription() {
        return operation.getDescription();
    }

    public ToolOperation<I, O> getOperation() {
        return operation;
    }

    public FallbackConfig getFallbackConfig() {
        return fallbackConfig;
    }

    /**
     * Time to live used when storing results; null means the layer default.
     */
    public Duration getTtl() {
        return operation.getTtl();
    }

    /**
     * Cache key the given raw parameters map to.
     *
     * @throws ToolFailureException if the parameters are invalid
     */
    public String getCacheKey(Object rawParameters) {
        try {
            return operation.getCacheKey(operation.validateInput(rawParameters));
        } catch (ToolException e) {
            throw new ToolFailureException(errorHandler.handleError(e, getName(), "cache-key", null), e);
        }
    }

    public Mono<ToolResult<O>> execute(Object rawParameters) {
        return execute(rawParameters, ToolContext.defaults());
    }

    public Mono<ToolResult<O>> execute(Object rawParameters, ToolContext callerContext) {
        return Mono.defer(() -> {
            ToolContext context = (callerContext != null ? callerContext : ToolContext.defaults())
                    .resolve(getName(), EXECUTE, rawParameters);
            ExecutionMetrics metrics = startMetrics(context);

            I input;
            try {
                input = operation.validateInput(rawParameters);
            } catch (RuntimeException e) {
                return Mono.error(failure(e, context, metrics));
            }

            String cacheKey = cacheKeyOrNull(input, context);
            if (cacheKey != null && !context.isBypassCache() && !operation.shouldBypassCache(input)) {
                Optional<O> cached = cacheManager.get(operation.getCacheLayer(), cacheKey, operation.getOutputType());
                if (cached.isPresent()) {
                    metrics.setCacheHit(true);
                    logComplete(context, metrics, ExecutionStatus.CACHED, cached.get());
                    return Mono.just(result(cached.get(), ExecutionStatus.CACHED, null, context, metrics));
                }
            }
            metrics.setCacheHit(false);

            return executeResiliently(input, context, metrics)
                    .map(operation::transformOutput)
                    .map(output -> {
                        store(cacheKey, output, context);
                        logComplete(context, metrics, ExecutionStatus.SUCCESS, output);
                        return result(output, ExecutionStatus.SUCCESS, null, context, metrics);
                    })
                    .onErrorResume(primary -> recover(primary, input, cacheKey, context, metrics));
        });
    }

    /**
     * Probe the tool with its health check parameters. No cache, retries or fallbacks apply.
     */
    public Mono<HealthReport> healthCheck() {
        Optional<Object> parameters = operation.getHealthCheckParameters();
        Instant checkedAt = clock.instant();
        if (parameters.isEmpty()) {
            return Mono.just(HealthReport.builder()
                    .toolName(getName())
                    .status(HealthReport.Status.HEALTHY)
                    .details(Map.of("message", "No health check configured"))
                    .checkedAt(checkedAt)
                    .build());
        }

        ToolContext context = ToolContext.builder()
                .operation("health-check")
                .bypassCache(true)
                .store(false)
                .build()
                .resolve(getName(), "health-check", parameters.get());

        return Mono.defer(() -> timed(operation.executeCore(operation.validateInput(parameters.get()), context)))
                .map(operation::transformOutput)
                .map(output -> HealthReport.builder()
                        .toolName(getName())
                        .status(HealthReport.Status.HEALTHY)
                        .details(Map.of("durationMs", elapsedMillis(checkedAt)))
                        .checkedAt(checkedAt)
                        .build())
                .onErrorResume(error -> {
                    log.warn("Health check failed for {}: {}", getName(), error.getMessage());
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("error", String.valueOf(error.getMessage()));
                    details.put("durationMs", elapsedMillis(checkedAt));
                    return Mono.just(HealthReport.builder()
                            .toolName(getName())
                            .status(HealthReport.Status.FAILED)
                            .details(details)
                            .checkedAt(checkedAt)
                            .build());
                });
    }

    private Mono<Object> executeResiliently(I input, ToolContext context, ExecutionMetrics metrics) {
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(fallbackConfig.getMaxRetries() + 1)
                .baseDelay(fallbackConfig.getRetryDelay())
                .multiplier(fallbackConfig.getBackoffMultiplier())
                .maxDelay(fallbackConfig.getMaxRetryDelay())
                .build();
        AtomicInteger attempts = new AtomicInteger();

        return errorHandler.executeWithRetry(() -> {
            if (attempts.getAndIncrement() > 0) {
                metrics.incrementRetryCount();
            }
            return errorHandler.executeWithCircuitBreaker(getName(),
                    () -> timed(operation.executeCore(input, context)), null);
        }, getName(), EXECUTE, policy);
    }

    private Mono<Object> timed(Mono<?> call) {
        Duration timeout = fallbackConfig.getOperationTimeout();
        return call
                .cast(Object.class)
                .switchIfEmpty(Mono.error(() -> new ToolException(getName() + " returned no result",
                        ErrorCategory.EXECUTION)))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new OperationTimeoutException(getName(), timeout, e));
    }

    private Mono<ToolResult<O>> recover(Throwable primary, I input, String cacheKey, ToolContext context,
                                        ExecutionMetrics metrics) {
        ErrorCategory category = errorHandler.categorize(primary, getName(), EXECUTE).getCategory();
        List<FallbackStrategy> chain = fallbackConfig.strategyChain();
        if (!fallbackConfig.isEnableFallback() || !category.allowsFallback() || chain.get(0) == FallbackStrategy.FAIL) {
            return Mono.error(failure(primary, context, metrics));
        }

        logWarning(context, "Primary execution failed, trying fallback",
                Map.of("error", String.valueOf(primary.getMessage()), "strategies", chain));

        return runChain(chain, 0, input, cacheKey, context, null)
                .map(fallback -> {
                    ExecutionStatus status = fallback.strategy == FallbackStrategy.PARTIAL
                            ? ExecutionStatus.PARTIAL
                            : ExecutionStatus.DEGRADED;
                    logComplete(context, metrics, status, fallback.value);
                    return result(fallback.value, status, fallback.strategy, context, metrics);
                })
                .onErrorResume(fallbackError -> Mono.error(failure(
                        new FallbackFailedException(getName(), primary, fallbackError), context, metrics)));
    }

    private Mono<Fallback<O>> runChain(List<FallbackStrategy> chain, int index, I input, String cacheKey,
                                       ToolContext context, Throwable lastError) {
        if (index >= chain.size() || chain.get(index) == FallbackStrategy.FAIL) {
            return Mono.error(lastError);
        }
        FallbackStrategy strategy = chain.get(index);
        return Mono.defer(() -> runStrategy(strategy, input, cacheKey, context))
                .switchIfEmpty(Mono.error(() -> new ToolException(strategy + " fallback produced no result",
                        ErrorCategory.EXECUTION)))
                .map(value -> {
                    log.info("Fallback {} succeeded for {}", strategy, getName());
                    return new Fallback<>(strategy, value);
                })
                .onErrorResume(error -> {
                    log.debug("Fallback {} failed for {}: {}", strategy, getName(), error.getMessage());
                    return runChain(chain, index + 1, input, cacheKey, context, error);
                });
    }

    private Mono<O> runStrategy(FallbackStrategy strategy, I input, String cacheKey, ToolContext context) {
        switch (strategy) {
            case CACHE:
                return cachedFallback(cacheKey);
            case SIMPLIFIED:
                return operation.executeSimplified(input, context).timeout(fallbackConfig.getOperationTimeout());
            case PARTIAL:
                return operation.executePartial(input, context).timeout(fallbackConfig.getOperationTimeout());
            case DEFAULT:
                return Mono.justOrEmpty(operation.getDefaultResult(input))
                        .switchIfEmpty(Mono.error(() -> new ToolException(
                                "No default result available for " + getName(), ErrorCategory.EXECUTION)));
            case FAIL:
            default:
                return Mono.error(new ToolException("No fallback available for " + getName(),
                        ErrorCategory.EXECUTION));
        }
    }

    private Mono<O> cachedFallback(String cacheKey) {
        if (cacheKey == null) {
            return Mono.error(new ToolException("No cached result available for " + getName(),
                    ErrorCategory.RESOURCE));
        }
        // peek so the fallback read is not counted as a second lookup
        Optional<O> live = cacheManager.peek(operation.getCacheLayer(), cacheKey)
                .filter(operation.getOutputType()::isInstance)
                .map(operation.getOutputType()::cast);
        if (live.isPresent()) {
            return Mono.just(live.get());
        }
        O stale = lastKnownGood.getIfPresent(cacheKey);
        if (stale != null) {
            log.info("Serving last known good result for {}: key={}", getName(), cacheKey);
            return Mono.just(stale);
        }
        return Mono.error(new ToolException("No cached result available for " + getName(), ErrorCategory.RESOURCE));
    }

    private ToolFailureException failure(Throwable error, ToolContext context, ExecutionMetrics metrics) {
        ErrorResponse response = errorHandler.handleError(error, getName(), context.getOperation(),
                context.getRequestId());
        try {
            executionLogger.logError(context, metrics, error);
        } catch (RuntimeException e) {
            log.warn("Execution logger failed for {}: {}", getName(), e.getMessage());
        }
        return new ToolFailureException(response, error);
    }

    private void store(String cacheKey, O output, ToolContext context) {
        if (cacheKey == null || output == null || !context.isStore()) {
            return;
        }
        cacheManager.set(operation.getCacheLayer(), cacheKey, output, operation.getTtl());
        try {
            lastKnownGood.put(cacheKey, output);
        } catch (RuntimeException e) {
            log.warn("Could not keep last known good result for {}: {}", getName(), e.getMessage());
        }
    }

    private String cacheKeyOrNull(I input, ToolContext context) {
        try {
            return operation.getCacheKey(input);
        } catch (RuntimeException e) {
            logWarning(context, "Cache key unavailable, caching disabled for this call",
                    Map.of("error", String.valueOf(e.getMessage())));
            return null;
        }
    }

    private ExecutionMetrics startMetrics(ToolContext context) {
        try {
            return executionLogger.logStart(context);
        } catch (RuntimeException e) {
            log.warn("Execution logger failed for {}: {}", getName(), e.getMessage());
            return ExecutionMetrics.startedAt(clock.instant());
        }
    }

    private void logComplete(ToolContext context, ExecutionMetrics metrics, ExecutionStatus status, O output) {
        try {
            executionLogger.logComplete(context, metrics, status, output);
        } catch (RuntimeException e) {
            log.warn("Execution logger failed for {}: {}", getName(), e.getMessage());
        }
    }

    private void logWarning(ToolContext context, String message, Map<String, Object> details) {
        try {
            executionLogger.logWarning(context, message, details);
        } catch (RuntimeException e) {
            log.warn("Execution logger failed for {}: {}", getName(), e.getMessage());
        }
    }

    private ToolResult<O> result(O value, ExecutionStatus status, FallbackStrategy strategy, ToolContext context,
                                 ExecutionMetrics metrics) {
        return ToolResult.<O>builder()
                .value(value)
                .status(status)
                .cacheHit(status == ExecutionStatus.CACHED)
                .fallbackStrategy(strategy)
                .durationMs(elapsedMillis(metrics.getStartTime()))
                .sessionId(context.getSessionId())
                .traceId(context.getTraceId())
                .build();
    }

    private long elapsedMillis(Instant since) {
        if (since == null) {
            return 0;
        }
        return Math.max(0, Duration.between(since, clock.instant()).toMillis());
    }

    private static final class Fallback<O> {
        private final FallbackStrategy strategy;
        private final O value;

        private Fallback(FallbackStrategy strategy, O value) {
            this.strategy = strategy;
            this.value = value;
        }
    }
}
