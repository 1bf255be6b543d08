package com.tessera.service.error;

import com.tessera.model.dto.CircuitBreakerState;
import com.tessera.model.dto.ErrorResponse;
import com.tessera.model.dto.StandardizedError;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Central place where tool failures are categorized, reported, retried and
 * short-circuited.
 *
 * Retry and circuit breaking are composed by the caller, typically
 * {@code executeWithRetry(() -> executeWithCircuitBreaker(name, core, null), ...)}.
 */
@Slf4j
public class ToolErrorHandler {

    private final CircuitBreakerRegistry circuitBreakers;
    private final ErrorClassifier classifier;
    private final ContextSanitizer sanitizer;
    private final RetryPolicy defaultRetryPolicy;
    private final boolean fallbackEnabled;
    private final Clock clock;

    public ToolErrorHandler(CircuitBreakerRegistry circuitBreakers,
                            ErrorClassifier classifier,
                            ContextSanitizer sanitizer,
                            RetryPolicy defaultRetryPolicy,
                            boolean fallbackEnabled,
                            Clock clock) {
        this.circuitBreakers = circuitBreakers;
        this.classifier = classifier;
        this.sanitizer = sanitizer;
        this.defaultRetryPolicy = defaultRetryPolicy;
        this.fallbackEnabled = fallbackEnabled;
        this.clock = clock;
    }

    /**
     * Turn any failure into the caller-facing error envelope and log it by severity.
     * Circuit breaker state is not touched here.
     */
    public ErrorResponse handleError(Throwable error, String toolName, String operation, String requestId) {
        ToolException categorized = categorize(error, toolName, operation);
        ErrorCategory category = categorized.getCategory();
        ErrorSeverity severity = categorized.getSeverity();
        String tool = categorized.getToolName() != null ? categorized.getToolName() : toolName;
        String op = categorized.getOperation() != null ? categorized.getOperation() : operation;

        StandardizedError standardized = StandardizedError.builder()
                .code(errorCode(category, severity))
                .message(categorized.getMessage())
                .category(category)
                .severity(severity)
                .toolName(tool)
                .operation(op)
                .timestamp(clock.instant())
                .requestId(requestId)
                .suggestions(category.getSuggestions())
                .sanitizedContext(sanitizer.sanitize(categorized.getContext()))
                .build();

        logBySeverity(standardized, categorized);

        return ErrorResponse.builder()
                .error(standardized)
                .metadata(ErrorResponse.Metadata.builder()
                        .degradationStrategy(category.getDegradationStrategy())
                        .retryable(category.isRetryable())
                        .retryAfterMs(category.isRetryable() ? retryAfterMs(tool) : null)
                        .build())
                .build();
    }

    /**
     * Run the operation through the named circuit breaker.
     *
     * @param fallback used when the breaker rejects the call and fallbacks are enabled; may be null
     */
    public <T> Mono<T> executeWithCircuitBreaker(String serviceName,
                                                 Supplier<Mono<T>> operation,
                                                 Supplier<Mono<T>> fallback) {
        return Mono.defer(() -> {
            CircuitBreaker breaker = circuitBreakers.get(serviceName);
            if (!breaker.tryAcquire()) {
                if (fallback != null && fallbackEnabled) {
                    log.warn("Circuit breaker {} for {}, using fallback", breaker.getState(), serviceName);
                    return fallback.get();
                }
                return Mono.error(new CircuitOpenException(serviceName, breaker.getState(),
                        breaker.remainingOpenTime().toMillis()));
            }

            Mono<T> call;
            try {
                call = operation.get();
            } catch (RuntimeException e) {
                breaker.recordFailure();
                return Mono.error(e);
            }
            return call
                    .doOnSuccess(value -> breaker.recordSuccess())
                    .doOnError(error -> breaker.recordFailure())
                    .doOnCancel(breaker::releaseHalfOpenSlot);
        });
    }

    /**
     * Retry with the default backoff and the given number of attempts.
     */
    public <T> Mono<T> executeWithRetry(Supplier<Mono<T>> operation, String toolName, String operationName,
                                        int maxAttempts) {
        return executeWithRetry(operation, toolName, operationName,
                defaultRetryPolicy.toBuilder().maxAttempts(maxAttempts).build());
    }

    /**
     * Subscribe up to {@code policy.maxAttempts} times. Non-retryable failures and
     * open-breaker rejections end the loop at once; after the last attempt the last
     * failure is propagated as-is.
     */
    public <T> Mono<T> executeWithRetry(Supplier<Mono<T>> operation, String toolName, String operationName,
                                        RetryPolicy policy) {
        return Mono.defer(operation)
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    Throwable failure = signal.failure();
                    ErrorCategory category = classifier.categoryOf(failure);
                    int attempt = (int) signal.totalRetries() + 1;

                    if (!category.isRetryable() || failure instanceof CircuitOpenException) {
                        log.debug("Not retrying {} {}: category={}", toolName, operationName, category);
                        return Mono.error(failure);
                    }
                    if (attempt >= policy.getMaxAttempts()) {
                        log.warn("Giving up on {} {} after {} attempts: {}",
                                toolName, operationName, attempt, failure.getMessage());
                        return Mono.error(failure);
                    }

                    Duration delay = policy.delayForRetry(attempt);
                    log.warn("Attempt {}/{} of {} {} failed ({}), retrying in {}ms",
                            attempt, policy.getMaxAttempts(), toolName, operationName,
                            failure.getMessage(), delay.toMillis());
                    return Mono.delay(delay);
                })));
    }

    /**
     * Whether the named service would currently accept a call.
     */
    public boolean isServiceAvailable(String serviceName) {
        return circuitBreakers.find(serviceName)
                .map(CircuitBreaker::isCallPermitted)
                .orElse(true);
    }

    public boolean resetCircuitBreaker(String serviceName) {
        return circuitBreakers.reset(serviceName);
    }

    public Map<String, CircuitBreakerState> getCircuitBreakerStates() {
        return circuitBreakers.snapshots();
    }

    public ToolException categorize(Throwable error, String toolName, String operation) {
        return classifier.classify(error, toolName, operation);
    }

    public RetryPolicy getDefaultRetryPolicy() {
        return defaultRetryPolicy;
    }

    public boolean isFallbackEnabled() {
        return fallbackEnabled;
    }

    static String errorCode(ErrorCategory category, ErrorSeverity severity) {
        return "TOOL_" + category.name().replace("_", "") + "_" + severity.name();
    }

    private long retryAfterMs(String toolName) {
        if (toolName != null) {
            long remaining = circuitBreakers.find(toolName)
                    .map(breaker -> breaker.remainingOpenTime().toMillis())
                    .orElse(0L);
            if (remaining > 0) {
                return remaining;
            }
        }
        return defaultRetryPolicy.getBaseDelay().toMillis();
    }

    private void logBySeverity(StandardizedError error, Throwable cause) {
        switch (error.getSeverity()) {
            case CRITICAL:
            case HIGH:
                log.error("[{}] {} {} failed: {}", error.getCode(), error.getToolName(), error.getOperation(),
                        error.getMessage(), cause);
                break;
            case MEDIUM:
                log.warn("[{}] {} {} failed: {}", error.getCode(), error.getToolName(), error.getOperation(),
                        error.getMessage());
                break;
            case LOW:
                log.info("[{}] {} {} failed: {}", error.getCode(), error.getToolName(), error.getOperation(),
                        error.getMessage());
                break;
            case INFO:
            default:
                log.debug("[{}] {} {} failed: {}", error.getCode(), error.getToolName(), error.getOperation(),
                        error.getMessage());
                break;
        }
    }
}
