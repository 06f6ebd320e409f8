package com.keystone.core.orchestrator;

import com.keystone.core.error.AgentCallException;
import com.keystone.core.model.AgentDescriptor;
import com.keystone.core.model.AgentHealth;
import com.keystone.core.model.AgentResponse;
import com.keystone.core.model.AgentTask;

import java.time.Duration;

/**
 * Transport to a worker agent.
 */
public interface AgentClient {

    /**
     * Send one task to one agent.
     *
     * @throws AgentCallException on any failure; {@link AgentCallException#isRetryable()}
     *                            tells the caller whether another try makes sense
     */
    AgentResponse call(AgentDescriptor agent, AgentTask task, Duration timeout);

    /**
     * Probe the agent's health endpoint.
     *
     * @throws AgentCallException if the agent cannot be reached
     */
    AgentHealth ping(AgentDescriptor agent, Duration timeout);
}
