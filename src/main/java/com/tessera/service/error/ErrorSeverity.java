package com.tessera.service.error;

/**
 * Severity of a categorized failure, used for log levels and error codes.
 */
public enum ErrorSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO
}
