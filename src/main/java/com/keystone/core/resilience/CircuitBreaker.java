package com.keystone.core.resilience;

import com.keystone.core.model.CircuitBreakerState;
import com.keystone.core.model.CircuitState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-agent circuit breaker.
 * <p>
 * State machine:
 * <ul>
 *   <li>CLOSED: calls pass; consecutive failures are counted and reaching the threshold opens the circuit.</li>
 *   <li>OPEN: calls are refused until the cooldown elapses.</li>
 *   <li>HALF_OPEN: exactly one trial call is admitted. Success closes the circuit;
 *       failure re-opens it with the cooldown doubled, capped at the maximum.</li>
 * </ul>
 * All transitions happen under a single lock so concurrent callers observe one
 * consistent state.
 */
public class CircuitBreaker {

    /** Receives every state change. */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String agentId, CircuitState from, CircuitState to);
    }

    private final String agentId;
    private final int failureThreshold;
    private final Duration baseCooldown;
    private final Duration maxCooldown;
    private final Clock clock;
    private final TransitionListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailure;
    private Instant nextRetryEligible;
    private Duration currentCooldown;
    private boolean trialInFlight;
    private int timesOpened;
    private long totalCalls;
    private long totalFailures;

    public CircuitBreaker(String agentId, int failureThreshold, Duration baseCooldown, Duration maxCooldown,
                          Clock clock, TransitionListener listener) {
        this.agentId = agentId;
        this.failureThreshold = failureThreshold;
        this.baseCooldown = baseCooldown;
        this.maxCooldown = maxCooldown;
        this.clock = clock;
        this.listener = listener != null ? listener : (id, from, to) -> { };
        this.currentCooldown = baseCooldown;
    }

    /**
     * Ask whether a call may proceed. An OPEN circuit whose cooldown has elapsed
     * moves to HALF_OPEN and the caller becomes the single trial.
     *
     * @return {@code true} if the caller may invoke the agent
     */
    public boolean tryAcquirePermission() {
        CircuitState from = null;
        boolean permitted;
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    permitted = true;
                    break;
                case OPEN:
                    if (!clock.instant().isBefore(nextRetryEligible)) {
                        from = state;
                        state = CircuitState.HALF_OPEN;
                        nextRetryEligible = null;
                        trialInFlight = true;
                        permitted = true;
                    } else {
                        permitted = false;
                    }
                    break;
                case HALF_OPEN:
                    if (trialInFlight) {
                        permitted = false;
                    } else {
                        trialInFlight = true;
                        permitted = true;
                    }
                    break;
                default:
                    permitted = false;
            }
            if (permitted) {
                totalCalls++;
            }
        } finally {
            lock.unlock();
        }
        if (from != null) {
            listener.onTransition(agentId, from, CircuitState.HALF_OPEN);
        }
        return permitted;
    }

    public void recordSuccess() {
        CircuitState from = null;
        lock.lock();
        try {
            failureCount = 0;
            trialInFlight = false;
            if (state != CircuitState.CLOSED) {
                from = state;
                state = CircuitState.CLOSED;
                nextRetryEligible = null;
                currentCooldown = baseCooldown;
            }
        } finally {
            lock.unlock();
        }
        if (from != null) {
            listener.onTransition(agentId, from, CircuitState.CLOSED);
        }
    }

    public void recordFailure() {
        CircuitState from = null;
        lock.lock();
        try {
            Instant now = clock.instant();
            failureCount++;
            totalFailures++;
            lastFailure = now;
            if (state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
                Duration doubled = currentCooldown.multipliedBy(2);
                currentCooldown = doubled.compareTo(maxCooldown) > 0 ? maxCooldown : doubled;
                from = open(now);
            } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
                currentCooldown = baseCooldown;
                from = open(now);
            }
        } finally {
            lock.unlock();
        }
        if (from != null) {
            listener.onTransition(agentId, from, CircuitState.OPEN);
        }
    }

    /** Force the breaker back to CLOSED with counters and cooldown cleared. */
    public void reset() {
        CircuitState from;
        lock.lock();
        try {
            from = state;
            state = CircuitState.CLOSED;
            failureCount = 0;
            nextRetryEligible = null;
            currentCooldown = baseCooldown;
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
        if (from != CircuitState.CLOSED) {
            listener.onTransition(agentId, from, CircuitState.CLOSED);
        }
    }

    public CircuitBreakerState snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerState(agentId, state, failureCount, lastFailure, nextRetryEligible,
                    timesOpened, totalCalls, totalFailures);
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public String getAgentId() {
        return agentId;
    }

    Duration currentCooldown() {
        return currentCooldown;
    }

    private CircuitState open(Instant now) {
        CircuitState from = state;
        state = CircuitState.OPEN;
        nextRetryEligible = now.plus(currentCooldown);
        timesOpened++;
        return from;
    }
}
