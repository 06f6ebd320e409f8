package com.keystone.core.error;

import java.util.Map;

/**
 * No agent advertising the required capability could serve a task.
 * Carries the per-agent reason for each candidate that was skipped or failed.
 */
public class AgentUnavailableException extends KeystoneException {

    private final String capability;
    private final Map<String, String> reasons;

    public AgentUnavailableException(String capability, Map<String, String> reasons) {
        super("No agent available for capability '" + capability + "'"
                + (reasons.isEmpty() ? " (no candidates)" : ": " + reasons));
        this.capability = capability;
        this.reasons = Map.copyOf(reasons);
    }

    public String getCapability() {
        return capability;
    }

    public Map<String, String> getReasons() {
        return reasons;
    }
}
