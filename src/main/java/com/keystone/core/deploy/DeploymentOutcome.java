package com.keystone.core.deploy;

import com.keystone.core.model.DeploymentStrategy;

import java.util.List;

/**
 * What a strategy did.
 *
 * @param success          the artifact is live and serving all traffic
 * @param rollbackRequired live traffic was exposed to the artifact and the target must be restored
 * @param environmentId    environment the artifact ended up in, if any
 * @param detail           human-readable account of the outcome
 * @param observations     canary samples taken during the monitoring window
 */
public record DeploymentOutcome(
    DeploymentStrategy strategy,
    boolean success,
    boolean rollbackRequired,
    String environmentId,
    String detail,
    List<CanaryMetrics> observations
) {

    public DeploymentOutcome {
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public static DeploymentOutcome succeeded(DeploymentStrategy strategy, String environmentId, String detail) {
        return new DeploymentOutcome(strategy, true, false, environmentId, detail, List.of());
    }

    /** Failed before the active environment was touched. */
    public static DeploymentOutcome failedClean(DeploymentStrategy strategy, String environmentId, String detail) {
        return new DeploymentOutcome(strategy, false, false, environmentId, detail, List.of());
    }
}
