package com.keystone.core.model;

/**
 * Outcome of a successful orchestrator dispatch.
 *
 * @param agentId   the agent that served the task
 * @param response  the agent's reply
 * @param elapsedMs wall time of the winning call, retries included
 */
public record DispatchResult(
    String agentId,
    AgentResponse response,
    long elapsedMs
) {}
