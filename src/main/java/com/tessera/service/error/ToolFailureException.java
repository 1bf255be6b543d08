package com.tessera.service.error;

import com.tessera.model.dto.ErrorResponse;
import lombok.Getter;

/**
 * Terminal failure of a tool invocation, carrying the caller-facing error envelope.
 */
@Getter
public class ToolFailureException extends ToolException {

    private final ErrorResponse response;

    public ToolFailureException(ErrorResponse response, Throwable cause) {
        super(response.getError().getMessage(),
                response.getError().getCategory(),
                response.getError().getSeverity(),
                response.getError().getToolName(),
                response.getError().getOperation(),
                response.getError().getSanitizedContext(),
                cause);
        this.response = response;
    }

    public String getCode() {
        return response.getError().getCode();
    }
}
