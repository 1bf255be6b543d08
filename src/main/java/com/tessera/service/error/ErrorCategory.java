package com.tessera.service.error;

import java.util.List;

/**
 * Fixed taxonomy of tool failures.
 *
 * Each category carries its retry eligibility, default severity, degradation
 * strategy and the remediation hints shown to callers.
 */
public enum ErrorCategory {

    VALIDATION(false, ErrorSeverity.MEDIUM, DegradationStrategy.FAIL, List.of(
            "Check input parameters for correct format and values",
            "Refer to tool documentation for required parameters")),

    PERFORMANCE(true, ErrorSeverity.HIGH, DegradationStrategy.RETRY, List.of(
            "Reduce request complexity or size",
            "Consider breaking operation into smaller chunks")),

    EXTERNAL(true, ErrorSeverity.HIGH, DegradationStrategy.CIRCUIT, List.of(
            "Check network connectivity",
            "Verify external service is available",
            "Consider using cached data if available")),

    RATE_LIMIT(true, ErrorSeverity.MEDIUM, DegradationStrategy.RETRY, List.of(
            "Implement exponential backoff for retries",
            "Reduce request frequency")),

    AUTHORIZATION(false, ErrorSeverity.HIGH, DegradationStrategy.FAIL, List.of(
            "Check authentication credentials",
            "Verify required permissions are granted")),

    RESOURCE(true, ErrorSeverity.MEDIUM, DegradationStrategy.FALLBACK, List.of(
            "Check if file or resource exists",
            "Verify permissions for resource access")),

    SYSTEM(false, ErrorSeverity.CRITICAL, DegradationStrategy.FAIL, List.of(
            "Check available memory and open file handles",
            "Retry once system load has decreased")),

    EXECUTION(true, ErrorSeverity.MEDIUM, DegradationStrategy.RETRY, List.of(
            "Retry the operation",
            "Check tool logs for details using the trace id"));

    private final boolean retryable;
    private final ErrorSeverity defaultSeverity;
    private final DegradationStrategy degradationStrategy;
    private final List<String> suggestions;

    ErrorCategory(boolean retryable, ErrorSeverity defaultSeverity, DegradationStrategy degradationStrategy,
                  List<String> suggestions) {
        this.retryable = retryable;
        this.defaultSeverity = defaultSeverity;
        this.degradationStrategy = degradationStrategy;
        this.suggestions = suggestions;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public ErrorSeverity getDefaultSeverity() {
        return defaultSeverity;
    }

    public DegradationStrategy getDegradationStrategy() {
        return degradationStrategy;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    /**
     * Whether a failure of this category may be answered with fallback data.
     * Validation and authorization failures always reach the caller as-is.
     */
    public boolean allowsFallback() {
        return this != VALIDATION && this != AUTHORIZATION;
    }
}
