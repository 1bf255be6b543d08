package com.tessera.service.validation;

/**
 * Turns raw, untyped tool input into a typed value or a list of issues.
 *
 * @param <T> typed input
 */
@FunctionalInterface
public interface InputValidator<T> {

    ValidationResult<T> validate(Object raw);
}
