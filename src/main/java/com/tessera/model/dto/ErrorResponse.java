package com.tessera.model.dto;

import com.tessera.service.error.DegradationStrategy;
import lombok.Builder;
import lombok.Value;

/**
 * Error envelope returned for every unrecoverable tool failure.
 */
@Value
@Builder
public class ErrorResponse {

    @Builder.Default
    boolean success = false;

    StandardizedError error;

    Metadata metadata;

    @Value
    @Builder
    public static class Metadata {
        DegradationStrategy degradationStrategy;
        boolean retryable;

        /**
         * Only set for retryable failures.
         */
        Long retryAfterMs;
    }
}
