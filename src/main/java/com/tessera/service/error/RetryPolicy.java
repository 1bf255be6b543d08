package com.tessera.service.error;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    /**
     * Total subscriptions including the first one.
     */
    @Builder.Default
    int maxAttempts = 4;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(10);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /**
     * Delay before retry number {@code retry} (1-based): {@code baseDelay * multiplier^(retry-1)},
     * capped at {@code maxDelay}.
     */
    public Duration delayForRetry(int retry) {
        double factor = Math.pow(multiplier, Math.max(0, retry - 1));
        double millis = baseDelay.toMillis() * factor;
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(0, capped));
    }
}
