package com.keystone.core.error;

public class DuplicateAgentException extends KeystoneException {

    public DuplicateAgentException(String agentId) {
        super("Agent already registered: " + agentId);
    }
}
