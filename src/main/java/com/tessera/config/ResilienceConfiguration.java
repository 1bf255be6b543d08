package com.tessera.config;

import com.tessera.service.error.CircuitBreakerConfig;
import com.tessera.service.error.CircuitBreakerRegistry;
import com.tessera.service.error.ContextSanitizer;
import com.tessera.service.error.ErrorClassifier;
import com.tessera.service.error.RetryPolicy;
import com.tessera.service.error.ToolErrorHandler;
import com.tessera.service.metrics.ExecutionLogger;
import com.tessera.service.metrics.InMemoryExecutionLogger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Error handling, circuit breaking and execution logging beans.
 */
@Configuration
public class ResilienceConfiguration {

    private final TesseraProperties properties;

    public ResilienceConfiguration(TesseraProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock clock) {
        TesseraProperties.CircuitBreakerProperties circuitBreaker = properties.getErrorHandler().getCircuitBreaker();
        return new CircuitBreakerRegistry(CircuitBreakerConfig.builder()
                .failureThreshold(circuitBreaker.getFailureThreshold())
                .recoveryTimeout(circuitBreaker.getRecoveryTimeout())
                .halfOpenMaxCalls(circuitBreaker.getHalfOpenMaxCalls())
                .build(), clock);
    }

    @Bean
    public ToolErrorHandler toolErrorHandler(CircuitBreakerRegistry circuitBreakerRegistry, Clock clock) {
        TesseraProperties.RetryProperties retry = properties.getErrorHandler().getRetry();
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(retry.getMaxRetries() + 1)
                .baseDelay(retry.getBaseDelay())
                .multiplier(retry.getMultiplier())
                .maxDelay(retry.getMaxDelay())
                .build();
        return new ToolErrorHandler(circuitBreakerRegistry, new ErrorClassifier(), new ContextSanitizer(),
                retryPolicy, properties.getErrorHandler().getDegradation().isEnableFallbacks(), clock);
    }

    @Bean
    public ExecutionLogger executionLogger(Clock clock) {
        return new InMemoryExecutionLogger(clock);
    }
}
