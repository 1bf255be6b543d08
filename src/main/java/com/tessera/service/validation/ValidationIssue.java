package com.tessera.service.validation;

import lombok.Value;

/**
 * One rejected input field.
 */
@Value
public class ValidationIssue {

    /**
     * Dotted property path, empty for the whole input.
     */
    String path;

    String message;

    @Override
    public String toString() {
        return path == null || path.isEmpty() ? message : path + ": " + message;
    }
}
