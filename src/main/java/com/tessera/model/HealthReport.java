package com.tessera.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class HealthReport {

    public enum Status {
        HEALTHY,
        FAILED
    }

    String toolName;
    Status status;
    Map<String, Object> details;
    Instant checkedAt;

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
