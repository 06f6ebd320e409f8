package com.keystone.core.model;

/**
 * Liveness of a registered worker agent, ordered by ascending severity.
 */
public enum AgentHealth {
    HEALTHY,
    DEGRADED,
    UNREACHABLE;

    /** Next step down after a run of missed heartbeats. */
    public AgentHealth degrade() {
        return this == HEALTHY ? DEGRADED : UNREACHABLE;
    }
}
