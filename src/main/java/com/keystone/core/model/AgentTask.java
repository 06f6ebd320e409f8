package com.keystone.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of work routed to a worker agent.
 *
 * @param id                 task id, used for log correlation
 * @param requiredCapability capability tag an agent must advertise to receive the task
 * @param payload            opaque task body forwarded to the agent
 * @param timeout            per-call deadline; {@code null} means the configured default
 */
public record AgentTask(
    String id,
    String requiredCapability,
    Map<String, Object> payload,
    Duration timeout
) implements Serializable {

    public AgentTask {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
