package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Point-in-time view of one agent's circuit breaker.
 * <p>
 * {@code nextRetryEligible} is non-null exactly when the state is OPEN.
 */
public record CircuitBreakerState(
    String agentId,
    CircuitState state,
    int failureCount,
    Instant lastFailure,
    Instant nextRetryEligible,
    int timesOpened,
    long totalCalls,
    long totalFailures
) implements Serializable {}
