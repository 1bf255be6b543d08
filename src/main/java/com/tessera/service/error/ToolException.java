package com.tessera.service.error;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of all categorized tool failures.
 *
 * Thrown at the point where the category is known, so the error handler never
 * has to guess it from message text.
 */
@Getter
public class ToolException extends RuntimeException {

    private final ErrorCategory category;
    private final ErrorSeverity severity;
    private final String toolName;
    private final String operation;
    private final Map<String, Object> context;

    public ToolException(String message, ErrorCategory category) {
        this(message, category, category.getDefaultSeverity(), null, null, Map.of(), null);
    }

    public ToolException(String message, ErrorCategory category, Throwable cause) {
        this(message, category, category.getDefaultSeverity(), null, null, Map.of(), cause);
    }

    public ToolException(String message,
                         ErrorCategory category,
                         ErrorSeverity severity,
                         String toolName,
                         String operation,
                         Map<String, Object> context,
                         Throwable cause) {
        super(message, cause);
        this.category = category;
        this.severity = severity;
        this.toolName = toolName;
        this.operation = operation;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public boolean isRetryable() {
        return category.isRetryable();
    }
}
