package com.keystone.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of one component check. Severity order is UP &lt; DEGRADED &lt; DOWN.
 */
public record HealthStatus(
        String component,
        Status status,
        String detail,
        Map<String, String> metadata
) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Worst status among the checks; UP when there are none. */
    public static Status rollUp(Collection<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().ordinal() > worst.ordinal()) {
                worst = check.status();
            }
        }
        return worst;
    }
}
