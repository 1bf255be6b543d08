package com.tessera.tool.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.model.FallbackStrategy;
import com.tessera.model.ToolContext;
import com.tessera.model.ToolResult;
import com.tessera.service.cache.MultiLayerCacheManager;
import com.tessera.service.error.CircuitBreakerConfig;
import com.tessera.service.error.CircuitBreakerRegistry;
import com.tessera.service.error.ContextSanitizer;
import com.tessera.service.error.ErrorCategory;
import com.tessera.service.error.ErrorClassifier;
import com.tessera.service.error.RetryPolicy;
import com.tessera.service.error.ToolErrorHandler;
import com.tessera.service.error.ToolFailureException;
import com.tessera.service.error.ValidationException;
import com.tessera.service.metrics.ExecutionStatus;
import com.tessera.service.metrics.InMemoryExecutionLogger;
import com.tessera.service.validation.BeanInputValidator;
import com.tessera.support.MutableClock;
import com.tessera.tool.ResilientToolAdapter;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProjectAnalysisOperation, run directly and through the resilient adapter.
 */
class ProjectAnalysisOperationTest {

    @TempDir
    Path projectDir;

    private ValidatorFactory validatorFactory;
    private MutableClock clock;
    private ProjectAnalysisOperation operation;
    private ResilientToolAdapter<ProjectAnalysisRequest, ProjectAnalysis> adapter;

    @BeforeEach
    void setUp() throws IOException {
        write("pom.xml", "<project/>\n");
        write("src/main/java/App.java", "class App {\n}\n");
        write("src/main/java/Util.java", "class Util {}");
        write("src/test/java/AppTest.java", "class AppTest {\n}\n");
        write("web/index.ts", "export {};\n");
        write("tests/test_app.py", "def test():\n    pass\n");
        write("node_modules/lib/index.js", "module.exports = {};\n");

        ObjectMapper objectMapper = new ObjectMapper();
        validatorFactory = Validation.buildDefaultValidatorFactory();
        operation = new ProjectAnalysisOperation(new ProjectAnalyzer(),
                new BeanInputValidator<>(ProjectAnalysisRequest.class, objectMapper, validatorFactory.getValidator()),
                objectMapper, projectDir.toString());

        clock = new MutableClock();
        ToolErrorHandler errorHandler = new ToolErrorHandler(
                new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(), clock),
                new ErrorClassifier(), new ContextSanitizer(), RetryPolicy.defaults(), true, clock);
        adapter = new ResilientToolAdapter<>(operation,
                operation.getDefaultFallbackConfig().toBuilder().maxRetries(0).build(),
                new MultiLayerCacheManager(Map.of(), objectMapper, clock, Duration.ofMinutes(1)),
                errorHandler, new InMemoryExecutionLogger(clock), clock);
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void testAnalyzesLanguagesBuildFilesAndTestDirectories() {
        ProjectAnalysis analysis = operation.executeCore(request().build(), ToolContext.defaults()).block();

        assertEquals(Map.of("Java", 3L, "TypeScript", 1L, "Python", 1L), analysis.getLanguages());
        assertEquals(List.of("pom.xml"), analysis.getBuildFiles());
        assertEquals(List.of("src/test", "tests"), analysis.getTestDirectories());
        assertEquals(6, analysis.getTotalFiles());
        assertEquals(0, analysis.getTotalLines());
        assertEquals(5, analysis.getLargestFiles().size());
        assertEquals(ProjectAnalysis.Strategy.FULL, analysis.getStrategy());
        assertEquals(operation.getCacheKey(request().build()), analysis.getCacheKey());
    }

    @Test
    void testDeepAnalysisCountsLines() {
        ProjectAnalysis analysis = operation.executeCore(request().deep(true).build(), ToolContext.defaults()).block();

        assertEquals(9, analysis.getTotalLines());
    }

    @Test
    void testSimplifiedAnalysisScansTopLevelOnly() {
        ProjectAnalysis analysis = operation.executeSimplified(request().build(), ToolContext.defaults()).block();

        assertEquals(ProjectAnalysis.Strategy.SIMPLIFIED, analysis.getStrategy());
        assertEquals(1, analysis.getTotalFiles());
        assertTrue(analysis.getLanguages().isEmpty());
        assertEquals(List.of("tests"), analysis.getTestDirectories());
    }

    @Test
    void testIncludeAndExcludePatterns() {
        ProjectAnalysis javaOnly = operation.executeCore(request().include(List.of("**/*.java")).build(),
                ToolContext.defaults()).block();
        ProjectAnalysis withoutTests = operation.executeCore(request().exclude(List.of("src/test")).build(),
                ToolContext.defaults()).block();

        assertEquals(3, javaOnly.getTotalFiles());
        assertEquals(Map.of("Java", 3L), javaOnly.getLanguages());
        assertEquals(2L, withoutTests.getLanguages().get("Java"));
        assertEquals(List.of("tests"), withoutTests.getTestDirectories());
    }

    @Test
    void testCacheKeyIgnoresPatternOrder() {
        String key = operation.getCacheKey(request().include(List.of("a/**", "b/**")).build());

        assertTrue(key.matches("analysis:[0-9a-f]{16}"), key);
        assertEquals(key, operation.getCacheKey(request().include(List.of("b/**", "a/**")).build()));
        assertNotEquals(key, operation.getCacheKey(request().include(List.of("a/**", "b/**")).deep(true).build()));
    }

    @Test
    void testRepeatedAnalysisIsServedFromCache() {
        Map<String, Object> parameters = Map.of("projectPath", projectDir.toString());

        ToolResult<ProjectAnalysis> first = adapter.execute(parameters).block();
        ToolResult<ProjectAnalysis> second = adapter.execute(parameters).block();

        assertEquals(ExecutionStatus.SUCCESS, first.getStatus());
        assertEquals(ExecutionStatus.CACHED, second.getStatus());
        assertEquals(first.getValue(), second.getValue());
    }

    @Test
    void testForceFreshBypassesCache() {
        adapter.execute(Map.of("projectPath", projectDir.toString())).block();

        ToolResult<ProjectAnalysis> result = adapter.execute(Map.of(
                "projectPath", projectDir.toString(),
                "forceFresh", true)).block();

        assertEquals(ExecutionStatus.SUCCESS, result.getStatus());
        assertFalse(result.isCacheHit());
    }

    @Test
    void testMissingPathDegradesToEmptyAnalysis() {
        String missing = projectDir.resolve("missing").toString();

        ToolResult<ProjectAnalysis> result = adapter.execute(Map.of("projectPath", missing)).block();

        assertEquals(ExecutionStatus.DEGRADED, result.getStatus());
        assertEquals(FallbackStrategy.DEFAULT, result.getFallbackStrategy());
        assertEquals(ProjectAnalysis.Strategy.FALLBACK, result.getValue().getStrategy());
        assertEquals(0, result.getValue().getTotalFiles());
        assertEquals(missing, result.getValue().getProjectPath());
    }

    @Test
    void testFilePathIsRejected() {
        String file = projectDir.resolve("pom.xml").toString();

        ToolFailureException error = assertThrows(ToolFailureException.class,
                () -> adapter.execute(Map.of("projectPath", file)).block());

        assertEquals(ErrorCategory.VALIDATION, error.getCategory());
        assertTrue(error.getMessage().startsWith("Invalid project path, not a directory"));
    }

    @Test
    void testBlankPathFailsValidation() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> operation.validateInput(Map.of("projectPath", "")));

        assertEquals("Invalid parameters provided: projectPath: Project path is required", error.getMessage());
    }

    @Test
    void testHealthCheckAnalyzesConfiguredPath() {
        assertTrue(adapter.healthCheck().block().isHealthy());
    }

    private ProjectAnalysisRequest.ProjectAnalysisRequestBuilder request() {
        return ProjectAnalysisRequest.builder().projectPath(projectDir.toString());
    }

    private void write(String relative, String content) throws IOException {
        Path file = projectDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
