package com.tessera.service.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validator backed by Jackson conversion and Jakarta Bean Validation.
 *
 * Raw input (usually a map decoded from JSON) is converted to the target type;
 * conversion errors and constraint violations are both reported as issues.
 */
@Slf4j
public class BeanInputValidator<T> implements InputValidator<T> {

    private final Class<T> type;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public BeanInputValidator(Class<T> type, ObjectMapper objectMapper, Validator validator) {
        this.type = type;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @Override
    public ValidationResult<T> validate(Object raw) {
        if (raw == null) {
            return ValidationResult.invalid("", "Parameters are required");
        }

        T value;
        try {
            value = type.isInstance(raw) ? type.cast(raw) : objectMapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            log.debug("Could not convert input to {}", type.getSimpleName(), e);
            return ValidationResult.invalid("", "Malformed parameters: " + rootMessage(e));
        }

        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (violations.isEmpty()) {
            return ValidationResult.ok(value);
        }

        List<ValidationIssue> issues = violations.stream()
                .map(violation -> new ValidationIssue(violation.getPropertyPath().toString(), violation.getMessage()))
                .sorted(Comparator.comparing(ValidationIssue::getPath))
                .collect(Collectors.toList());
        return ValidationResult.invalid(issues);
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null) {
            return root.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
