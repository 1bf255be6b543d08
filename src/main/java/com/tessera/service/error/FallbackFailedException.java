package com.tessera.service.error;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Both the primary execution and every configured fallback failed.
 */
@Getter
public class FallbackFailedException extends ToolException {

    private final Throwable primaryError;
    private final Throwable fallbackError;

    public FallbackFailedException(String toolName, Throwable primaryError, Throwable fallbackError) {
        super("Both primary and fallback execution failed for " + toolName
                        + " (primary: " + describe(primaryError) + "; fallback: " + describe(fallbackError) + ")",
                ErrorCategory.EXECUTION,
                ErrorSeverity.HIGH,
                toolName,
                "fallback",
                context(primaryError, fallbackError),
                primaryError);
        this.primaryError = primaryError;
        this.fallbackError = fallbackError;
        if (fallbackError != null) {
            addSuppressed(fallbackError);
        }
    }

    private static Map<String, Object> context(Throwable primaryError, Throwable fallbackError) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("primaryError", describe(primaryError));
        context.put("fallbackError", describe(fallbackError));
        return context;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "none";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
