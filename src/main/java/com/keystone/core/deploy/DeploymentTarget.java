package com.keystone.core.deploy;

import com.keystone.core.model.Submission;
import com.keystone.core.model.TargetState;

/**
 * The environment a project's artifacts are deployed to.
 * <p>
 * A target always has exactly one active environment receiving traffic. Blue-green
 * and canary rollouts provision a standby environment next to it; only
 * {@link #applyInPlace}, {@link #switchTraffic} and {@link #restore} change the
 * active environment.
 */
public interface DeploymentTarget {

    TargetState capture(String targetId);

    /** Make the active environment exactly {@code state}. Restoring the same state twice is a no-op. */
    void restore(TargetState state);

    void applyInPlace(String targetId, Submission submission);

    /**
     * Stand up an inactive environment running the submission.
     *
     * @return id of the new environment
     */
    String provisionStandby(String targetId, Submission submission);

    /** Send all traffic to the standby environment, making it active. */
    void switchTraffic(String targetId, String environmentId);

    void teardown(String targetId, String environmentId);

    /** Route {@code percent} of traffic to the standby environment. */
    void routeTraffic(String targetId, String environmentId, int percent);

    CanaryMetrics sample(String targetId, String environmentId);
}
