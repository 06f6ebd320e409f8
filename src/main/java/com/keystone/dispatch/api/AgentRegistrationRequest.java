package com.keystone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/agents.
 */
public record AgentRegistrationRequest(
    String id,
    List<String> capabilities,
    String endpoint,
    @JsonProperty("max_load") Integer maxLoad
) {}
