package com.tessera.service.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of validating raw tool input: either a typed value or a list of issues.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult<T> {

    private final boolean ok;
    private final T value;
    private final List<ValidationIssue> issues;

    public static <T> ValidationResult<T> ok(T value) {
        return new ValidationResult<>(true, value, List.of());
    }

    public static <T> ValidationResult<T> invalid(List<ValidationIssue> issues) {
        return new ValidationResult<>(false, null, List.copyOf(issues));
    }

    public static <T> ValidationResult<T> invalid(String path, String message) {
        return invalid(List.of(new ValidationIssue(path, message)));
    }
}
