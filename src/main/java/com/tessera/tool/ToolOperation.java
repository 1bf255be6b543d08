package com.tessera.tool;

import com.tessera.model.FallbackConfig;
import com.tessera.model.ToolContext;
import com.tessera.service.cache.CacheLayer;
import com.tessera.service.error.ErrorCategory;
import com.tessera.service.error.ToolException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * A backend operation exposed as a tool.
 * Implementations supply the domain logic; caching, retries, circuit breaking
 * and fallbacks are applied by {@link ResilientToolAdapter}.
 *
 * @param <I> validated input
 * @param <O> output returned to callers and stored in the cache
 */
public interface ToolOperation<I, O> {

    /**
     * Get the tool name (e.g., "project-analysis").
     *
     * @return tool name, also used as circuit breaker name
     */
    String getName();

    String getDescription();

    CacheLayer getCacheLayer();

    Class<O> getOutputType();

    /**
     * Validate raw input.
     *
     * @throws com.tessera.service.error.ValidationException if the input is rejected
     */
    I validateInput(Object rawParameters);

    /**
     * Cache key for the given input. Keys only need to be unique within the cache layer.
     */
    String getCacheKey(I input);

    /**
     * Time to live of cached results; null uses the layer default.
     */
    default Duration getTtl() {
        return null;
    }

    /**
     * Run the operation.
     *
     * @return raw result, turned into the output by {@link #transformOutput(Object)}
     */
    Mono<?> executeCore(I input, ToolContext context);

    O transformOutput(Object rawResult);

    /**
     * Retry, timeout and fallback settings used when nothing is configured for the tool.
     */
    default FallbackConfig getDefaultFallbackConfig() {
        return FallbackConfig.defaults();
    }

    default Mono<O> executeSimplified(I input, ToolContext context) {
        return Mono.error(new ToolException("Simplified execution not supported by " + getName(),
                ErrorCategory.EXECUTION));
    }

    default Mono<O> executePartial(I input, ToolContext context) {
        return Mono.error(new ToolException("Partial execution not supported by " + getName(),
                ErrorCategory.EXECUTION));
    }

    default Optional<O> getDefaultResult(I input) {
        return Optional.empty();
    }

    /**
     * Parameters for a health probe; empty if the tool cannot be probed.
     */
    default Optional<Object> getHealthCheckParameters() {
        return Optional.empty();
    }

    default boolean shouldBypassCache(I input) {
        return false;
    }
}
