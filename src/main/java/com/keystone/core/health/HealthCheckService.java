package com.keystone.core.health;

import com.keystone.core.deploy.DeploymentTarget;
import com.keystone.core.integration.ProjectLockRegistry;
import com.keystone.core.model.AgentDescriptor;
import com.keystone.core.model.AgentHealth;
import com.keystone.core.registry.AgentRegistry;
import com.keystone.core.resilience.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AgentRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final ProjectLockRegistry locks;
    private final DeploymentTarget deploymentTarget;
    private final DataSource dataSource;

    public HealthCheckService(
            AgentRegistry registry,
            CircuitBreakerRegistry breakers,
            ProjectLockRegistry locks,
            @Autowired(required = false) DeploymentTarget deploymentTarget,
            @Autowired(required = false) DataSource dataSource) {
        this.registry = registry;
        this.breakers = breakers;
        this.locks = locks;
        this.deploymentTarget = deploymentTarget;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkAgents());
        results.add(checkCircuits());
        results.add(checkDatabase());
        results.add(checkDeploymentTarget());
        return results;
    }

    HealthStatus checkAgents() {
        List<AgentDescriptor> agents = registry.listAll();
        long healthy = agents.stream().filter(a -> a.health() == AgentHealth.HEALTHY).count();
        long degraded = agents.stream().filter(a -> a.health() == AgentHealth.DEGRADED).count();
        long unreachable = agents.size() - healthy - degraded;
        Map<String, String> metadata = Map.of(
                "healthy", String.valueOf(healthy),
                "degraded", String.valueOf(degraded),
                "unreachable", String.valueOf(unreachable));
        if (agents.isEmpty()) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED, "No agents registered", metadata);
        }
        if (healthy == 0) {
            return new HealthStatus("agents", HealthStatus.Status.DOWN, "No healthy agents", metadata);
        }
        if (healthy < agents.size()) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                    healthy + " of " + agents.size() + " agents healthy", metadata);
        }
        return new HealthStatus("agents", HealthStatus.Status.UP, agents.size() + " agents healthy", metadata);
    }

    private HealthStatus checkCircuits() {
        List<String> open = breakers.listOpen();
        if (open.isEmpty()) {
            return new HealthStatus("circuits", HealthStatus.Status.UP, "All circuits closed",
                    Map.of("activeLocks", String.valueOf(locks.held().size())));
        }
        return new HealthStatus("circuits", HealthStatus.Status.DEGRADED,
                open.size() + " circuit(s) open", Map.of("open", String.join(",", open)));
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.UP,
                    "In-memory store (no DataSource configured)", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkDeploymentTarget() {
        if (deploymentTarget == null) {
            return new HealthStatus("deployment-target", HealthStatus.Status.DOWN,
                    "No DeploymentTarget configured", Map.of());
        }
        return new HealthStatus("deployment-target", HealthStatus.Status.UP,
                "DeploymentTarget available (" + deploymentTarget.getClass().getSimpleName() + ")", Map.of());
    }
}
