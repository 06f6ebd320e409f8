package com.keystone.core.model;

/**
 * Per-agent circuit breaker state.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
