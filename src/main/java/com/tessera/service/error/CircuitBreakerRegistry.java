package com.tessera.service.error;

import com.tessera.model.dto.CircuitBreakerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One circuit breaker per service name, created on first use.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig config;
    private final Clock clock;

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public CircuitBreaker get(String serviceName) {
        return breakers.computeIfAbsent(serviceName, name -> {
            log.debug("Creating circuit breaker: service={}", name);
            return new CircuitBreaker(name, config, clock);
        });
    }

    public Optional<CircuitBreaker> find(String serviceName) {
        return Optional.ofNullable(breakers.get(serviceName));
    }

    /**
     * Forget the breaker; the next call starts from a fresh CLOSED breaker.
     *
     * @return true if a breaker existed
     */
    public boolean reset(String serviceName) {
        boolean removed = breakers.remove(serviceName) != null;
        if (removed) {
            log.info("Circuit breaker reset: service={}", serviceName);
        }
        return removed;
    }

    public void resetAll() {
        breakers.clear();
    }

    /**
     * Snapshots of all known breakers, ordered by service name.
     */
    public Map<String, CircuitBreakerState> snapshots() {
        Map<String, CircuitBreakerState> states = new TreeMap<>();
        breakers.forEach((name, breaker) -> states.put(name, breaker.snapshot()));
        return states;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }
}
