package com.keystone.core.resilience;

import com.keystone.core.error.AgentCallException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry budget and backoff shape for agent calls.
 *
 * @param maxRetries retries after the first attempt
 * @param jitter     fraction of the computed delay added or subtracted at random, in [0,1)
 * @param retryable  decides whether a failure may be retried; anything else propagates immediately
 */
public record RetryPolicy(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    double jitter,
    Predicate<Throwable> retryable
) {

    public static final Predicate<Throwable> RETRYABLE_AGENT_ERRORS =
            t -> t instanceof AgentCallException ace && ace.isRetryable();

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be within [0,1)");
        }
        if (retryable == null) {
            retryable = RETRYABLE_AGENT_ERRORS;
        }
    }

    /**
     * Delay before retry number {@code attempt} (zero-based): base * 2^attempt
     * capped at the maximum, then spread by {@code jitterSample} in [-1,1].
     */
    public Duration delayFor(int attempt, double jitterSample) {
        long base = baseDelay.toMillis();
        long exp = attempt >= 30 ? Long.MAX_VALUE : base * (1L << attempt);
        if (exp < 0 || exp > maxDelay.toMillis()) {
            exp = maxDelay.toMillis();
        }
        long spread = Math.round(exp * jitter * jitterSample);
        return Duration.ofMillis(Math.max(0, exp + spread));
    }
}
