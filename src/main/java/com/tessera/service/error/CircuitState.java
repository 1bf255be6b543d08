package com.tessera.service.error;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
