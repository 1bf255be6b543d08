package com.tessera.service.error;

import jakarta.validation.ConstraintViolationException;
import reactor.core.Exceptions;

import java.io.FileNotFoundException;
import java.lang.reflect.UndeclaredThrowableException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Assigns a category to failures that arrive without one.
 *
 * Known exception types are mapped directly; anything else is matched against
 * message keywords in a fixed priority order, falling back to EXECUTION.
 */
public class ErrorClassifier {

    private static final List<Map.Entry<ErrorCategory, List<String>>> KEYWORD_RULES = List.of(
            Map.entry(ErrorCategory.VALIDATION, List.of("validation", "invalid")),
            Map.entry(ErrorCategory.PERFORMANCE, List.of("timeout", "timed out", "etimedout")),
            Map.entry(ErrorCategory.EXTERNAL, List.of(
                    "econnrefused", "connection refused", "enotfound", "network", "unreachable")),
            Map.entry(ErrorCategory.RATE_LIMIT, List.of("rate limit", "too many requests", "429")),
            Map.entry(ErrorCategory.AUTHORIZATION, List.of(
                    "permission", "unauthorized", "access denied", "forbidden")),
            Map.entry(ErrorCategory.RESOURCE, List.of("enoent", "not found", "no such file", "does not exist")),
            Map.entry(ErrorCategory.SYSTEM, List.of("out of memory", "enomem", "emfile", "too many open files")));

    /**
     * Categorize a failure. A {@link ToolException} is returned unchanged.
     */
    public ToolException classify(Throwable error, String toolName, String operation) {
        Throwable unwrapped = unwrap(error);
        if (unwrapped instanceof ToolException) {
            return (ToolException) unwrapped;
        }

        ErrorCategory category = categoryOf(unwrapped);
        String message = unwrapped.getMessage() != null && !unwrapped.getMessage().isBlank()
                ? unwrapped.getMessage()
                : unwrapped.getClass().getSimpleName();
        return new ToolException(message, category, category.getDefaultSeverity(), toolName, operation,
                Map.of("errorType", unwrapped.getClass().getName()), unwrapped);
    }

    public ErrorCategory categoryOf(Throwable error) {
        Throwable unwrapped = unwrap(error);
        if (unwrapped instanceof ToolException) {
            return ((ToolException) unwrapped).getCategory();
        }

        ErrorCategory byType = categoryByType(unwrapped);
        if (byType != null) {
            return byType;
        }

        String message = unwrapped.getMessage();
        if (message == null) {
            return ErrorCategory.EXECUTION;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<ErrorCategory, List<String>> rule : KEYWORD_RULES) {
            if (rule.getValue().stream().anyMatch(normalized::contains)) {
                return rule.getKey();
            }
        }
        return ErrorCategory.EXECUTION;
    }

    private static ErrorCategory categoryByType(Throwable error) {
        if (error instanceof ConstraintViolationException) {
            return ErrorCategory.VALIDATION;
        }
        if (error instanceof TimeoutException || error instanceof SocketTimeoutException) {
            return ErrorCategory.PERFORMANCE;
        }
        if (error instanceof ConnectException || error instanceof UnknownHostException
                || error instanceof NoRouteToHostException) {
            return ErrorCategory.EXTERNAL;
        }
        if (error instanceof AccessDeniedException || error instanceof SecurityException) {
            return ErrorCategory.AUTHORIZATION;
        }
        if (error instanceof NoSuchFileException || error instanceof FileNotFoundException) {
            return ErrorCategory.RESOURCE;
        }
        if (error instanceof OutOfMemoryError) {
            return ErrorCategory.SYSTEM;
        }
        return null;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = Exceptions.unwrap(error);
        while (current.getCause() != null
                && (current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof UndeclaredThrowableException)) {
            current = Exceptions.unwrap(current.getCause());
        }
        return current;
    }
}
