package com.tessera.service.error;

import java.time.Duration;
import java.util.Map;

/**
 * A tool operation did not complete within its configured timeout.
 */
public class OperationTimeoutException extends ToolException {

    public OperationTimeoutException(String toolName, Duration timeout, Throwable cause) {
        super("Operation timed out after " + timeout.toMillis() + "ms",
                ErrorCategory.PERFORMANCE,
                ErrorSeverity.HIGH,
                toolName,
                "execute",
                Map.of("timeoutMs", timeout.toMillis()),
                cause);
    }
}
