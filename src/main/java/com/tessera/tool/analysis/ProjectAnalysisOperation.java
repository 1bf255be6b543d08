package com.tessera.tool.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.model.FallbackConfig;
import com.tessera.model.FallbackStrategy;
import com.tessera.model.ToolContext;
import com.tessera.service.cache.CacheLayer;
import com.tessera.service.validation.InputValidator;
import com.tessera.tool.AbstractToolOperation;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Project analysis exposed as a tool.
 *
 * Falls back to the cached analysis, then a top-level scan, then an empty analysis.
 */
@Slf4j
public class ProjectAnalysisOperation extends AbstractToolOperation<ProjectAnalysisRequest, ProjectAnalysis> {

    public static final String NAME = "project-analysis";
    static final Duration TTL = Duration.ofMinutes(10);

    private final ProjectAnalyzer analyzer;
    private final String healthCheckPath;

    public ProjectAnalysisOperation(ProjectAnalyzer analyzer,
                                    InputValidator<ProjectAnalysisRequest> inputValidator,
                                    ObjectMapper objectMapper) {
        this(analyzer, inputValidator, objectMapper, System.getProperty("user.dir"));
    }

    public ProjectAnalysisOperation(ProjectAnalyzer analyzer,
                                    InputValidator<ProjectAnalysisRequest> inputValidator,
                                    ObjectMapper objectMapper,
                                    String healthCheckPath) {
        super(NAME, "Analyzes a project directory: languages, build files, test directories and file sizes",
                CacheLayer.PROJECT_ANALYSIS, inputValidator, ProjectAnalysis.class, objectMapper);
        this.analyzer = analyzer;
        this.healthCheckPath = healthCheckPath;
    }

    @Override
    public String getCacheKey(ProjectAnalysisRequest input) {
        Map<String, Object> material = new LinkedHashMap<>();
        material.put("projectPath", input.getProjectPath());
        material.put("deep", input.isDeep());
        material.put("include", sortedOrNull(input.getInclude()));
        material.put("exclude", sortedOrNull(input.getExclude()));
        return hashedKey("analysis", material);
    }

    @Override
    public Duration getTtl() {
        return TTL;
    }

    @Override
    public FallbackConfig getDefaultFallbackConfig() {
        return FallbackConfig.builder()
                .fallbackStrategy(FallbackStrategy.CACHE)
                .secondaryStrategy(FallbackStrategy.SIMPLIFIED)
                .secondaryStrategy(FallbackStrategy.DEFAULT)
                .maxRetries(2)
                .retryDelay(Duration.ofSeconds(1))
                .operationTimeout(Duration.ofSeconds(15))
                .build();
    }

    @Override
    public Mono<ProjectAnalysis> executeCore(ProjectAnalysisRequest input, ToolContext context) {
        return Mono.fromCallable(() -> {
                    log.info("Starting project analysis for: {} (deep={}, session={})",
                            input.getProjectPath(), input.isDeep(), context.getSessionId());
                    ProjectAnalysis analysis = analyzer.analyze(input, ProjectAnalyzer.Mode.FULL);
                    return analysis.toBuilder().cacheKey(getCacheKey(input)).build();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<ProjectAnalysis> executeSimplified(ProjectAnalysisRequest input, ToolContext context) {
        return Mono.fromCallable(() -> {
                    log.warn("Running simplified project analysis for: {}", input.getProjectPath());
                    ProjectAnalysis analysis = analyzer.analyze(input, ProjectAnalyzer.Mode.SHALLOW);
                    return analysis.toBuilder().cacheKey(getCacheKey(input)).build();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Optional<ProjectAnalysis> getDefaultResult(ProjectAnalysisRequest input) {
        return Optional.of(ProjectAnalysis.empty(input.getProjectPath(), ProjectAnalysis.Strategy.FALLBACK)
                .toBuilder()
                .cacheKey(getCacheKey(input))
                .build());
    }

    @Override
    public Optional<Object> getHealthCheckParameters() {
        return Optional.of(Map.of("projectPath", healthCheckPath));
    }

    @Override
    public boolean shouldBypassCache(ProjectAnalysisRequest input) {
        return input.isForceFresh();
    }

    private static List<String> sortedOrNull(List<String> values) {
        if (values == null) {
            return null;
        }
        List<String> sorted = new ArrayList<>(values);
        sorted.sort(null);
        return sorted;
    }
}
