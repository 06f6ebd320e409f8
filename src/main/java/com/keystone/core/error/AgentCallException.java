package com.keystone.core.error;

/**
 * A single call to an agent failed. {@code retryable} separates transient
 * failures (timeouts, connection errors, 5xx) from fatal ones.
 */
public class AgentCallException extends KeystoneException {

    private final String agentId;
    private final boolean retryable;

    public AgentCallException(String agentId, String message, boolean retryable) {
        super(message);
        this.agentId = agentId;
        this.retryable = retryable;
    }

    public AgentCallException(String agentId, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
        this.retryable = retryable;
    }

    public static AgentCallException retryable(String agentId, String message, Throwable cause) {
        return new AgentCallException(agentId, message, true, cause);
    }

    public static AgentCallException fatal(String agentId, String message) {
        return new AgentCallException(agentId, message, false);
    }

    public String getAgentId() {
        return agentId;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
