package com.tessera.service.error;

import com.tessera.model.dto.ErrorResponse;
import com.tessera.model.dto.StandardizedError;
import com.tessera.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ToolErrorHandler.
 */
class ToolErrorHandlerTest {

    private MutableClock clock;
    private CircuitBreakerRegistry registry;
    private ToolErrorHandler errorHandler;
    private RetryPolicy fastRetry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new CircuitBreakerRegistry(CircuitBreakerConfig.builder()
                .failureThreshold(3)
                .build(), clock);
        errorHandler = handler(true);
        fastRetry = RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofMillis(1))
                .maxDelay(Duration.ofMillis(5))
                .build();
    }

    @Test
    void testHandleErrorBuildsStandardizedError() {
        ErrorResponse response = errorHandler.handleError(new RuntimeException("Rate limit exceeded"),
                "analysis", "execute", "req-1");

        assertFalse(response.isSuccess());
        StandardizedError error = response.getError();
        assertEquals("TOOL_RATELIMIT_MEDIUM", error.getCode());
        assertEquals("Rate limit exceeded", error.getMessage());
        assertEquals(ErrorCategory.RATE_LIMIT, error.getCategory());
        assertEquals("analysis", error.getToolName());
        assertEquals("execute", error.getOperation());
        assertEquals("req-1", error.getRequestId());
        assertEquals(clock.instant(), error.getTimestamp());
        assertFalse(error.getSuggestions().isEmpty());

        assertEquals(DegradationStrategy.RETRY, response.getMetadata().getDegradationStrategy());
        assertTrue(response.getMetadata().isRetryable());
        assertEquals(1000L, response.getMetadata().getRetryAfterMs());
    }

    @Test
    void testNonRetryableErrorHasNoRetryAfter() {
        ErrorResponse response = errorHandler.handleError(new IllegalArgumentException("Invalid input"),
                "analysis", "execute", null);

        assertEquals("TOOL_VALIDATION_MEDIUM", response.getError().getCode());
        assertFalse(response.getMetadata().isRetryable());
        assertNull(response.getMetadata().getRetryAfterMs());
        assertEquals(DegradationStrategy.FAIL, response.getMetadata().getDegradationStrategy());
    }

    @Test
    void testHandleErrorKeepsToolExceptionTagsAndSanitizesContext() {
        ToolException error = new ToolException("Upstream down", ErrorCategory.EXTERNAL, ErrorSeverity.CRITICAL,
                "origin", "fetch", Map.of("apiKey", "secret-value", "host", "example.org"), null);

        ErrorResponse response = errorHandler.handleError(error, "analysis", "execute", null);

        assertEquals("TOOL_EXTERNAL_CRITICAL", response.getError().getCode());
        assertEquals("origin", response.getError().getToolName());
        assertEquals("fetch", response.getError().getOperation());
        assertEquals("[REDACTED]", response.getError().getSanitizedContext().get("apiKey"));
        assertEquals("example.org", response.getError().getSanitizedContext().get("host"));
    }

    @Test
    void testRetryAfterReflectsOpenBreaker() {
        CircuitBreaker breaker = registry.get("analysis");
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(20));

        ErrorResponse response = errorHandler.handleError(new RuntimeException("connection refused"),
                "analysis", "execute", null);

        assertEquals(40_000L, response.getMetadata().getRetryAfterMs());
    }

    @Test
    void testHandleErrorDoesNotTouchBreaker() {
        for (int i = 0; i < 5; i++) {
            errorHandler.handleError(new RuntimeException("boom"), "analysis", "execute", null);
        }

        assertTrue(errorHandler.isServiceAvailable("analysis"));
        assertTrue(errorHandler.getCircuitBreakerStates().isEmpty());
    }

    @Test
    void testRetryExhaustsAttempts() {
        AtomicInteger invocations = new AtomicInteger();

        RuntimeException error = assertThrows(RuntimeException.class, () -> errorHandler.executeWithRetry(() -> {
            invocations.incrementAndGet();
            return Mono.error(new RuntimeException("boom"));
        }, "analysis", "execute", fastRetry).block());

        assertEquals("boom", error.getMessage());
        assertEquals(3, invocations.get());
    }

    @Test
    void testRetrySucceedsAfterTransientFailures() {
        AtomicInteger invocations = new AtomicInteger();

        String result = errorHandler.executeWithRetry(() -> invocations.incrementAndGet() < 3
                ? Mono.<String>error(new RuntimeException("network glitch"))
                : Mono.just("ok"), "analysis", "execute", fastRetry).block();

        assertEquals("ok", result);
        assertEquals(3, invocations.get());
    }

    @Test
    void testValidationErrorIsAttemptedOnce() {
        AtomicInteger invocations = new AtomicInteger();

        assertThrows(ToolException.class, () -> errorHandler.executeWithRetry(() -> {
            invocations.incrementAndGet();
            return Mono.error(new ToolException("bad input", ErrorCategory.VALIDATION));
        }, "analysis", "execute", fastRetry).block());

        assertEquals(1, invocations.get());
    }

    @Test
    void testAuthorizationAndSystemErrorsAreNotRetried() {
        AtomicInteger invocations = new AtomicInteger();

        assertThrows(RuntimeException.class, () -> errorHandler.executeWithRetry(() -> {
            invocations.incrementAndGet();
            return Mono.error(new RuntimeException("Access denied"));
        }, "analysis", "execute", fastRetry).block());
        assertThrows(RuntimeException.class, () -> errorHandler.executeWithRetry(() -> {
            invocations.incrementAndGet();
            return Mono.error(new RuntimeException("too many open files"));
        }, "analysis", "execute", fastRetry).block());

        assertEquals(2, invocations.get());
    }

    @Test
    void testRetryWithAttemptCountUsesDefaultBackoff() {
        ToolErrorHandler handler = new ToolErrorHandler(registry, new ErrorClassifier(), new ContextSanitizer(),
                fastRetry, true, clock);
        AtomicInteger invocations = new AtomicInteger();

        assertThrows(RuntimeException.class, () -> handler.executeWithRetry(() -> {
            invocations.incrementAndGet();
            return Mono.error(new RuntimeException("boom"));
        }, "analysis", "execute", 2).block());

        assertEquals(2, invocations.get());
    }

    @Test
    void testBackoffDelays() {
        RetryPolicy policy = RetryPolicy.builder()
                .baseDelay(Duration.ofMillis(100))
                .multiplier(2.0)
                .maxDelay(Duration.ofMillis(500))
                .build();

        assertEquals(Duration.ofMillis(100), policy.delayForRetry(1));
        assertEquals(Duration.ofMillis(200), policy.delayForRetry(2));
        assertEquals(Duration.ofMillis(400), policy.delayForRetry(3));
        assertEquals(Duration.ofMillis(500), policy.delayForRetry(4));
    }

    @Test
    void testCircuitBreakerOpensAndRejects() {
        AtomicInteger invocations = new AtomicInteger();
        for (int i = 0; i < 3; i++) {
            assertThrows(RuntimeException.class, () -> errorHandler.executeWithCircuitBreaker("analysis", () -> {
                invocations.incrementAndGet();
                return Mono.<String>error(new RuntimeException("boom"));
            }, null).block());
        }

        CircuitOpenException rejected = assertThrows(CircuitOpenException.class,
                () -> errorHandler.executeWithCircuitBreaker("analysis", () -> {
                    invocations.incrementAndGet();
                    return Mono.just("never");
                }, null).block());

        assertEquals("Service analysis is currently unavailable (circuit breaker OPEN)", rejected.getMessage());
        assertEquals(ErrorCategory.EXTERNAL, rejected.getCategory());
        assertEquals(3, invocations.get());
        assertFalse(errorHandler.isServiceAvailable("analysis"));
    }

    @Test
    void testOpenBreakerUsesFallbackWhenEnabled() {
        openBreaker("analysis");

        String result = errorHandler.executeWithCircuitBreaker("analysis",
                () -> Mono.just("primary"), () -> Mono.just("fallback")).block();

        assertEquals("fallback", result);
    }

    @Test
    void testOpenBreakerIgnoresFallbackWhenDisabled() {
        ToolErrorHandler handler = handler(false);
        openBreaker("analysis");

        assertThrows(CircuitOpenException.class, () -> handler.executeWithCircuitBreaker("analysis",
                () -> Mono.just("primary"), () -> Mono.just("fallback")).block());
    }

    @Test
    void testBreakerRecoversThroughProbe() {
        openBreaker("analysis");
        clock.advance(Duration.ofSeconds(60));

        String result = errorHandler.executeWithCircuitBreaker("analysis", () -> Mono.just("ok"), null).block();

        assertEquals("ok", result);
        assertEquals(CircuitState.CLOSED, errorHandler.getCircuitBreakerStates().get("analysis").getState());
    }

    @Test
    void testCancelledCallsDoNotLockBreaker() {
        openBreaker("analysis");
        clock.advance(Duration.ofSeconds(60));

        for (int i = 0; i < 3; i++) {
            errorHandler.executeWithCircuitBreaker("analysis", Mono::<String>never, null)
                    .subscribe()
                    .dispose();
        }

        assertTrue(errorHandler.isServiceAvailable("analysis"));
        String result = errorHandler.executeWithCircuitBreaker("analysis", () -> Mono.just("ok"), null).block();
        assertEquals("ok", result);
        assertEquals(CircuitState.CLOSED, errorHandler.getCircuitBreakerStates().get("analysis").getState());
    }

    @Test
    void testRejectionNamesHalfOpenState() {
        openBreaker("analysis");
        clock.advance(Duration.ofSeconds(60));
        List<Disposable> pending = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            pending.add(errorHandler.executeWithCircuitBreaker("analysis", Mono::<String>never, null).subscribe());
        }

        CircuitOpenException rejected = assertThrows(CircuitOpenException.class,
                () -> errorHandler.executeWithCircuitBreaker("analysis", () -> Mono.just("ok"), null).block());

        assertEquals("Service analysis is currently unavailable (circuit breaker HALF_OPEN)", rejected.getMessage());
        assertEquals("HALF_OPEN", rejected.getContext().get("circuitState"));
        pending.forEach(Disposable::dispose);
        assertTrue(errorHandler.isServiceAvailable("analysis"));
    }

    @Test
    void testRetryStopsOnOpenBreaker() {
        openBreaker("analysis");
        AtomicInteger invocations = new AtomicInteger();

        assertThrows(CircuitOpenException.class, () -> errorHandler.executeWithRetry(
                () -> errorHandler.executeWithCircuitBreaker("analysis", () -> {
                    invocations.incrementAndGet();
                    return Mono.just("ok");
                }, null), "analysis", "execute", fastRetry).block());

        assertEquals(0, invocations.get());
    }

    @Test
    void testResetCircuitBreaker() {
        openBreaker("analysis");

        assertTrue(errorHandler.resetCircuitBreaker("analysis"));
        assertTrue(errorHandler.isServiceAvailable("analysis"));
        assertFalse(errorHandler.resetCircuitBreaker("analysis"));
    }

    private void openBreaker(String name) {
        CircuitBreaker breaker = registry.get(name);
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
    }

    private ToolErrorHandler handler(boolean fallbackEnabled) {
        return new ToolErrorHandler(registry, new ErrorClassifier(), new ContextSanitizer(),
                RetryPolicy.defaults(), fallbackEnabled, clock);
    }
}
