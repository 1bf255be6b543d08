package com.tessera.config;

import com.tessera.model.FallbackConfig;
import com.tessera.model.FallbackStrategy;
import com.tessera.service.cache.CacheLayerConfig;
import com.tessera.service.cache.EvictionPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Tessera.
 *
 * Unset per-layer and per-tool values keep the built-in defaults.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tessera")
public class TesseraProperties {

    private CacheProperties cache = new CacheProperties();
    private ErrorHandlerProperties errorHandler = new ErrorHandlerProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class CacheProperties {
        private Duration cleanupInterval = Duration.ofSeconds(60);

        /**
         * Overrides keyed by layer id, e.g. {@code project-analysis}.
         */
        private Map<String, LayerProperties> layers = new HashMap<>();
    }

    @Data
    public static class LayerProperties {
        private Integer maxEntries;
        private Duration defaultTtl;

        /**
         * Entries never expire; takes precedence over {@link #defaultTtl}.
         */
        private boolean neverExpire;

        private DataSize maxMemory;
        private EvictionPolicy evictionPolicy;

        public CacheLayerConfig applyTo(CacheLayerConfig base) {
            CacheLayerConfig.CacheLayerConfigBuilder builder = base.toBuilder();
            if (maxEntries != null) {
                builder.maxEntries(maxEntries);
            }
            if (neverExpire) {
                builder.defaultTtl(null);
            } else if (defaultTtl != null) {
                builder.defaultTtl(defaultTtl);
            }
            if (maxMemory != null) {
                builder.maxMemoryBytes(maxMemory.toBytes());
            }
            if (evictionPolicy != null) {
                builder.evictionPolicy(evictionPolicy);
            }
            return builder.build();
        }
    }

    @Data
    public static class ErrorHandlerProperties {
        private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
        private RetryProperties retry = new RetryProperties();
        private DegradationProperties degradation = new DegradationProperties();
    }

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private int halfOpenMaxCalls = 3;
    }

    @Data
    public static class RetryProperties {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(10);
    }

    @Data
    public static class DegradationProperties {
        private boolean enableFallbacks = true;
    }

    @Data
    public static class ToolsProperties {

        /**
         * Capacity of each tool's last-known-good store used by the CACHE fallback.
         */
        private int lastKnownGoodSize = 256;

        /**
         * Overrides keyed by tool name.
         */
        private Map<String, ToolProperties> overrides = new HashMap<>();
    }

    @Data
    public static class ToolProperties {
        private Boolean enableFallback;
        private FallbackStrategy fallbackStrategy;
        private List<FallbackStrategy> secondaryStrategies;
        private Integer maxRetries;
        private Duration retryDelay;
        private Double backoffMultiplier;
        private Duration maxRetryDelay;
        private Duration operationTimeout;

        public FallbackConfig applyTo(FallbackConfig base) {
            FallbackConfig.FallbackConfigBuilder builder = base.toBuilder();
            if (enableFallback != null) {
                builder.enableFallback(enableFallback);
            }
            if (fallbackStrategy != null) {
                builder.fallbackStrategy(fallbackStrategy);
            }
            if (secondaryStrategies != null) {
                builder.clearSecondaryStrategies().secondaryStrategies(secondaryStrategies);
            }
            if (maxRetries != null) {
                builder.maxRetries(maxRetries);
            }
            if (retryDelay != null) {
                builder.retryDelay(retryDelay);
            }
            if (backoffMultiplier != null) {
                builder.backoffMultiplier(backoffMultiplier);
            }
            if (maxRetryDelay != null) {
                builder.maxRetryDelay(maxRetryDelay);
            }
            if (operationTimeout != null) {
                builder.operationTimeout(operationTimeout);
            }
            return builder.build();
        }
    }
}
