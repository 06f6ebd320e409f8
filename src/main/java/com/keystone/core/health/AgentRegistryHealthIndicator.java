package com.keystone.core.health;

import com.keystone.core.registry.AgentRegistry;
import com.keystone.core.resilience.CircuitBreakerRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the worker-agent pool. Reports registry counts per
 * health state and the agents whose circuits are open.
 */
@Component("agentRegistryHealthIndicator")
public class AgentRegistryHealthIndicator implements HealthIndicator {

    private final AgentRegistry registry;
    private final CircuitBreakerRegistry breakers;

    public AgentRegistryHealthIndicator(AgentRegistry registry, CircuitBreakerRegistry breakers) {
        this.registry = registry;
        this.breakers = breakers;
    }

    @Override
    public Health health() {
        var stats = registry.stats();
        var builder = Health.up()
                .withDetail("agents", stats.get("total"))
                .withDetail("byHealth", stats.get("byHealth"))
                .withDetail("openCircuits", breakers.listOpen());
        return builder.build();
    }
}
