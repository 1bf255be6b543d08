package com.tessera.service.error;

import com.tessera.model.dto.CircuitBreakerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Failure-counting state machine guarding one service.
 *
 * CLOSED opens after {@code failureThreshold} consecutive failures. OPEN turns
 * HALF_OPEN once the recovery timeout has elapsed, checked whenever the breaker
 * is consulted. HALF_OPEN admits up to {@code halfOpenMaxCalls} probes: a probe
 * success closes the breaker, a probe failure opens it again. A cancelled call
 * gives its slot back; slots held longer than the recovery timeout are reclaimed.
 */
@Slf4j
public class CircuitBreaker {

    private final String serviceName;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int halfOpenProbesUsed;
    private Instant lastFailureTime;
    private Instant nextAttemptTime;
    private Instant lastHalfOpenAdmission;

    public CircuitBreaker(String serviceName, CircuitBreakerConfig config, Clock clock) {
        this.serviceName = serviceName;
        this.config = config;
        this.clock = clock;
    }

    public String getServiceName() {
        return serviceName;
    }

    public synchronized CircuitState getState() {
        refresh();
        return state;
    }

    /**
     * Ask permission for one call. Consumes a probe slot when half-open.
     *
     * @return false if the call must be rejected
     */
    public synchronized boolean tryAcquire() {
        refresh();
        switch (state) {
            case OPEN:
                return false;
            case HALF_OPEN:
                if (halfOpenProbesUsed >= config.getHalfOpenMaxCalls()) {
                    return false;
                }
                halfOpenProbesUsed++;
                lastHalfOpenAdmission = clock.instant();
                log.debug("Circuit breaker probe admitted: service={}, probe={}/{}",
                        serviceName, halfOpenProbesUsed, config.getHalfOpenMaxCalls());
                return true;
            case CLOSED:
            default:
                return true;
        }
    }

    /**
     * Whether a call would currently be admitted, without consuming a probe slot.
     */
    public synchronized boolean isCallPermitted() {
        refresh();
        if (state == CircuitState.OPEN) {
            return false;
        }
        return state != CircuitState.HALF_OPEN || halfOpenProbesUsed < config.getHalfOpenMaxCalls();
    }

    /**
     * Give back a half-open slot whose call ended without an outcome, e.g. a cancelled call.
     */
    public synchronized void releaseHalfOpenSlot() {
        if (state == CircuitState.HALF_OPEN && halfOpenProbesUsed > 0) {
            halfOpenProbesUsed--;
            log.debug("Circuit breaker half-open slot released: service={}, inFlight={}",
                    serviceName, halfOpenProbesUsed);
        }
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            log.info("Circuit breaker closed after successful probe: service={}", serviceName);
            state = CircuitState.CLOSED;
            halfOpenProbesUsed = 0;
            nextAttemptTime = null;
        }
        consecutiveFailures = 0;
    }

    public synchronized void recordFailure() {
        Instant now = clock.instant();
        consecutiveFailures++;
        lastFailureTime = now;

        if (state == CircuitState.HALF_OPEN) {
            open(now);
            log.warn("Circuit breaker re-opened after failed probe: service={}", serviceName);
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= config.getFailureThreshold()) {
            open(now);
            log.warn("Circuit breaker opened: service={}, consecutiveFailures={}", serviceName, consecutiveFailures);
        }
    }

    /**
     * Time until an open breaker admits probes; zero unless open.
     */
    public synchronized Duration remainingOpenTime() {
        refresh();
        if (state != CircuitState.OPEN) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), nextAttemptTime);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public synchronized CircuitBreakerState snapshot() {
        refresh();
        return CircuitBreakerState.builder()
                .serviceName(serviceName)
                .state(state)
                .consecutiveFailures(consecutiveFailures)
                .lastFailureTime(lastFailureTime)
                .halfOpenProbesUsed(halfOpenProbesUsed)
                .nextAttemptTime(state == CircuitState.OPEN ? nextAttemptTime : null)
                .build();
    }

    private void open(Instant now) {
        state = CircuitState.OPEN;
        halfOpenProbesUsed = 0;
        nextAttemptTime = now.plus(config.getRecoveryTimeout());
    }

    private void refresh() {
        if (state == CircuitState.OPEN && !clock.instant().isBefore(nextAttemptTime)) {
            state = CircuitState.HALF_OPEN;
            halfOpenProbesUsed = 0;
            log.info("Circuit breaker half-open: service={}", serviceName);
        } else if (state == CircuitState.HALF_OPEN
                && halfOpenProbesUsed >= config.getHalfOpenMaxCalls()
                && lastHalfOpenAdmission != null
                && !clock.instant().isBefore(lastHalfOpenAdmission.plus(config.getRecoveryTimeout()))) {
            halfOpenProbesUsed = 0;
            log.warn("Circuit breaker reclaimed stale half-open slots: service={}", serviceName);
        }
    }
}
