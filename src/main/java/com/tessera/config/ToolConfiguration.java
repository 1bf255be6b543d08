package com.tessera.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.model.FallbackConfig;
import com.tessera.service.cache.MultiLayerCacheManager;
import com.tessera.service.error.ToolErrorHandler;
import com.tessera.service.metrics.ExecutionLogger;
import com.tessera.service.validation.BeanInputValidator;
import com.tessera.tool.ResilientToolAdapter;
import com.tessera.tool.ToolOperation;
import com.tessera.tool.ToolRegistry;
import com.tessera.tool.analysis.ProjectAnalysisOperation;
import com.tessera.tool.analysis.ProjectAnalysisRequest;
import com.tessera.tool.analysis.ProjectAnalyzer;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tool operations and the registry that exposes them.
 * Every {@link ToolOperation} bean is wrapped in a {@link ResilientToolAdapter}.
 */
@Slf4j
@Configuration
public class ToolConfiguration {

    private final TesseraProperties properties;

    public ToolConfiguration(TesseraProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ProjectAnalysisOperation projectAnalysisOperation(ObjectMapper objectMapper, Validator validator) {
        return new ProjectAnalysisOperation(new ProjectAnalyzer(),
                new BeanInputValidator<>(ProjectAnalysisRequest.class, objectMapper, validator),
                objectMapper);
    }

    @Bean
    public ToolRegistry toolRegistry(List<ToolOperation<?, ?>> operations,
                                     MultiLayerCacheManager cacheManager,
                                     ToolErrorHandler errorHandler,
                                     ExecutionLogger executionLogger,
                                     Clock clock) {
        List<ResilientToolAdapter<?, ?>> adapters = operations.stream()
                .<ResilientToolAdapter<?, ?>>map(operation ->
                        adapt(operation, cacheManager, errorHandler, executionLogger, clock))
                .collect(Collectors.toList());
        return new ToolRegistry(adapters, errorHandler);
    }

    private <I, O> ResilientToolAdapter<I, O> adapt(ToolOperation<I, O> operation,
                                                    MultiLayerCacheManager cacheManager,
                                                    ToolErrorHandler errorHandler,
                                                    ExecutionLogger executionLogger,
                                                    Clock clock) {
        FallbackConfig fallbackConfig = operation.getDefaultFallbackConfig();
        TesseraProperties.ToolProperties overrides = properties.getTools().getOverrides().get(operation.getName());
        if (overrides != null) {
            fallbackConfig = overrides.applyTo(fallbackConfig);
            log.info("Tool {} configured: {}", operation.getName(), fallbackConfig);
        }
        return new ResilientToolAdapter<>(operation, fallbackConfig, cacheManager, errorHandler, executionLogger,
                clock, properties.getTools().getLastKnownGoodSize());
    }
}
