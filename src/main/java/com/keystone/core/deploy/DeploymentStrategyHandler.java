package com.keystone.core.deploy;

import com.keystone.core.error.DeploymentFailureException;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.Submission;

/**
 * One rollout strategy.
 */
public interface DeploymentStrategyHandler {

    DeploymentStrategy strategy();

    /**
     * Roll the submission onto the target. Exceptions mean the target's state is
     * unknown and must be restored.
     */
    DeploymentOutcome deploy(Submission submission, String targetId);

    /**
     * Strategies call this before each change to live state. The executor interrupts a
     * strategy it has given up on, and the interrupt must stop it before the next change.
     */
    static void ensureNotCancelled(String targetId) {
        if (Thread.currentThread().isInterrupted()) {
            throw new DeploymentFailureException("Deployment to " + targetId + " was cancelled");
        }
    }
}
