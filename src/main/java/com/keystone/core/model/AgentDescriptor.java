package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * Immutable snapshot of a worker agent as tracked by the registry.
 *
 * @param id                  unique agent id
 * @param capabilities        declared capability tags used for routing
 * @param endpoint            base URL of the agent's task API
 * @param health              current health state
 * @param consecutiveFailures failed dispatch calls since the last success
 * @param missedHeartbeats    consecutive heartbeat intervals without a sign of life
 * @param lastHeartbeat       last time the agent was heard from
 * @param currentLoad         dispatches currently in flight against this agent
 * @param maxLoad             advertised concurrency limit
 * @param registeredAt        registration time
 * @param tasksProcessed      successful dispatches
 * @param tasksFailed         failed dispatches
 * @param avgResponseMs       running average of successful call latency
 */
public record AgentDescriptor(
    String id,
    Set<String> capabilities,
    String endpoint,
    AgentHealth health,
    int consecutiveFailures,
    int missedHeartbeats,
    Instant lastHeartbeat,
    int currentLoad,
    int maxLoad,
    Instant registeredAt,
    long tasksProcessed,
    long tasksFailed,
    double avgResponseMs
) implements Serializable {

    public AgentDescriptor {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    /** Fresh descriptor for a newly registered agent. */
    public static AgentDescriptor register(String id, Set<String> capabilities, String endpoint,
                                           int maxLoad, Instant now) {
        return new AgentDescriptor(id, capabilities, endpoint, AgentHealth.HEALTHY,
                0, 0, now, 0, maxLoad, now, 0, 0, 0.0);
    }

    public boolean hasCapability(String tag) {
        return capabilities.contains(tag);
    }

    /** A non-positive {@code maxLoad} means no limit. */
    public boolean atCapacity() {
        return maxLoad > 0 && currentLoad >= maxLoad;
    }

    public AgentDescriptor withHeartbeat(AgentHealth reported, Instant now) {
        return new AgentDescriptor(id, capabilities, endpoint, reported, 0, 0, now,
                currentLoad, maxLoad, registeredAt, tasksProcessed, tasksFailed, avgResponseMs);
    }

    public AgentDescriptor withMissedHeartbeat(int missedPerStep) {
        int missed = missedHeartbeats + 1;
        AgentHealth next = health;
        if (missed % missedPerStep == 0) {
            next = health.degrade();
        }
        return new AgentDescriptor(id, capabilities, endpoint, next, consecutiveFailures, missed,
                lastHeartbeat, currentLoad, maxLoad, registeredAt, tasksProcessed, tasksFailed, avgResponseMs);
    }

    public AgentDescriptor withLoadDelta(int delta) {
        return new AgentDescriptor(id, capabilities, endpoint, health, consecutiveFailures, missedHeartbeats,
                lastHeartbeat, Math.max(0, currentLoad + delta), maxLoad, registeredAt,
                tasksProcessed, tasksFailed, avgResponseMs);
    }

    public AgentDescriptor withCallSuccess(long elapsedMs) {
        long processed = tasksProcessed + 1;
        double avg = avgResponseMs + (elapsedMs - avgResponseMs) / processed;
        return new AgentDescriptor(id, capabilities, endpoint, health, 0, missedHeartbeats,
                lastHeartbeat, currentLoad, maxLoad, registeredAt, processed, tasksFailed, avg);
    }

    public AgentDescriptor withCallFailure() {
        return new AgentDescriptor(id, capabilities, endpoint, health, consecutiveFailures + 1, missedHeartbeats,
                lastHeartbeat, currentLoad, maxLoad, registeredAt, tasksProcessed, tasksFailed + 1, avgResponseMs);
    }
}
