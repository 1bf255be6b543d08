package com.tessera.service.error;

import com.tessera.model.dto.CircuitBreakerState;
import com.tessera.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CircuitBreaker and CircuitBreakerRegistry.
 */
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new CircuitBreakerRegistry(CircuitBreakerConfig.builder()
                .failureThreshold(3)
                .recoveryTimeout(Duration.ofSeconds(60))
                .halfOpenMaxCalls(2)
                .build(), clock);
    }

    @Test
    void testOpensAfterThreshold() {
        CircuitBreaker breaker = registry.get("analysis");

        breaker.recordFailure();
        breaker.recordFailure();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(breaker.tryAcquire());

        breaker.recordFailure();
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertFalse(breaker.tryAcquire());
        assertEquals(Duration.ofSeconds(60), breaker.remainingOpenTime());
    }

    @Test
    void testSuccessWhileClosedResetsFailures() {
        CircuitBreaker breaker = registry.get("analysis");

        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(2, breaker.snapshot().getConsecutiveFailures());
    }

    @Test
    void testHalfOpenAfterRecoveryTimeout() {
        CircuitBreaker breaker = openBreaker("analysis");

        clock.advance(Duration.ofSeconds(59));
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(Duration.ofSeconds(1), breaker.remainingOpenTime());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(Duration.ZERO, breaker.remainingOpenTime());
    }

    @Test
    void testHalfOpenLimitsProbes() {
        CircuitBreaker breaker = openBreaker("analysis");
        clock.advance(Duration.ofSeconds(60));

        assertTrue(breaker.tryAcquire());
        assertTrue(breaker.tryAcquire());
        assertFalse(breaker.tryAcquire());
        assertFalse(breaker.isCallPermitted());
        assertEquals(2, breaker.snapshot().getHalfOpenProbesUsed());
    }

    @Test
    void testReleasedHalfOpenSlotCanBeReused() {
        CircuitBreaker breaker = openBreaker("analysis");
        clock.advance(Duration.ofSeconds(60));
        assertTrue(breaker.tryAcquire());
        assertTrue(breaker.tryAcquire());

        breaker.releaseHalfOpenSlot();

        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(1, breaker.snapshot().getHalfOpenProbesUsed());
        assertTrue(breaker.tryAcquire());
    }

    @Test
    void testReleaseOutsideHalfOpenIsIgnored() {
        CircuitBreaker breaker = registry.get("analysis");

        breaker.releaseHalfOpenSlot();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.snapshot().getHalfOpenProbesUsed());
    }

    @Test
    void testStaleHalfOpenSlotsAreReclaimed() {
        CircuitBreaker breaker = openBreaker("analysis");
        clock.advance(Duration.ofSeconds(60));
        assertTrue(breaker.tryAcquire());
        assertTrue(breaker.tryAcquire());
        assertFalse(breaker.isCallPermitted());

        clock.advance(Duration.ofSeconds(59));
        assertFalse(breaker.isCallPermitted());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(breaker.isCallPermitted());
        assertEquals(0, breaker.snapshot().getHalfOpenProbesUsed());
        assertTrue(breaker.tryAcquire());
    }

    @Test
    void testConcurrentCallersShareHalfOpenBudget() throws Exception {
        CircuitBreaker breaker = openBreaker("analysis");
        clock.advance(Duration.ofSeconds(60));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> callers = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                callers.add(breaker::tryAcquire);
            }
            int admitted = 0;
            for (Future<Boolean> future : executor.invokeAll(callers)) {
                if (future.get()) {
                    admitted++;
                }
            }
            assertEquals(2, admitted);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testConcurrentFailuresAreAllCounted() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("analysis", CircuitBreakerConfig.builder()
                .failureThreshold(1000)
                .build(), clock);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Void>> callers = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                callers.add(() -> {
                    breaker.recordFailure();
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(callers)) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(500, breaker.snapshot().getConsecutiveFailures());
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    void testProbeSuccessCloses() {
        CircuitBreaker breaker = openBreaker("analysis");
        clock.advance(Duration.ofSeconds(60));

        assertTrue(breaker.tryAcquire());
        breaker.recordSuccess();

        CircuitBreakerState state = breaker.snapshot();
        assertEquals(CircuitState.CLOSED, state.getState());
        assertEquals(0, state.getConsecutiveFailures());
        assertNull(state.getNextAttemptTime());
    }

    @Test
    void testProbeFailureReopens() {
        CircuitBreaker breaker = openBreaker("analysis");
        clock.advance(Duration.ofSeconds(60));

        assertTrue(breaker.tryAcquire());
        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(clock.instant().plusSeconds(60), breaker.snapshot().getNextAttemptTime());
    }

    @Test
    void testRegistryCreatesOneBreakerPerService() {
        assertSame(registry.get("a"), registry.get("a"));
        assertNotSame(registry.get("a"), registry.get("b"));
        assertEquals(2, registry.snapshots().size());
    }

    @Test
    void testResetRemovesBreaker() {
        openBreaker("analysis");

        assertTrue(registry.reset("analysis"));
        assertFalse(registry.reset("analysis"));
        assertTrue(registry.find("analysis").isEmpty());
        assertEquals(CircuitState.CLOSED, registry.get("analysis").getState());
    }

    private CircuitBreaker openBreaker(String name) {
        CircuitBreaker breaker = registry.get(name);
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        assertEquals(CircuitState.OPEN, breaker.getState());
        return breaker;
    }
}
