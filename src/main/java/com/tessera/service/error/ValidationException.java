package com.tessera.service.error;

import com.tessera.service.validation.ValidationIssue;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tool input rejected by validation. Never retried.
 */
@Getter
public class ValidationException extends ToolException {

    private final List<ValidationIssue> issues;

    public ValidationException(String toolName, List<ValidationIssue> issues) {
        super("Invalid parameters provided: " + summarize(issues),
                ErrorCategory.VALIDATION,
                ErrorSeverity.MEDIUM,
                toolName,
                "validate",
                Map.of("validationErrors", issues.stream()
                        .map(ValidationIssue::toString)
                        .collect(Collectors.toList())),
                null);
        this.issues = List.copyOf(issues);
    }

    private static String summarize(List<ValidationIssue> issues) {
        return issues.stream()
                .map(ValidationIssue::toString)
                .collect(Collectors.joining("; "));
    }
}
