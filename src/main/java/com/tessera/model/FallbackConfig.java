package com.tessera.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retry, timeout and degradation settings of one tool.
 */
@Value
@Builder(toBuilder = true)
public class FallbackConfig {

    @Builder.Default
    boolean enableFallback = true;

    @Builder.Default
    FallbackStrategy fallbackStrategy = FallbackStrategy.CACHE;

    /**
     * Tried in order after {@link #fallbackStrategy} fails.
     */
    @Singular
    List<FallbackStrategy> secondaryStrategies;

    /**
     * Retries after the first attempt.
     */
    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration retryDelay = Duration.ofSeconds(1);

    @Builder.Default
    double backoffMultiplier = 2.0;

    @Builder.Default
    Duration maxRetryDelay = Duration.ofSeconds(10);

    @Builder.Default
    Duration operationTimeout = Duration.ofSeconds(30);

    public static FallbackConfig defaults() {
        return FallbackConfig.builder().build();
    }

    /**
     * Primary strategy followed by the secondary ones.
     */
    public List<FallbackStrategy> strategyChain() {
        List<FallbackStrategy> chain = new ArrayList<>();
        chain.add(fallbackStrategy);
        chain.addAll(secondaryStrategies);
        return chain;
    }
}
