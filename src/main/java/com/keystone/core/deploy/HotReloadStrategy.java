package com.keystone.core.deploy;

import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.Submission;
import org.springframework.stereotype.Component;

/**
 * Applies the artifact in place on the active environment.
 */
@Component
public class HotReloadStrategy implements DeploymentStrategyHandler {

    private final DeploymentTarget target;

    public HotReloadStrategy(DeploymentTarget target) {
        this.target = target;
    }

    @Override
    public DeploymentStrategy strategy() {
        return DeploymentStrategy.HOT_RELOAD;
    }

    @Override
    public DeploymentOutcome deploy(Submission submission, String targetId) {
        DeploymentStrategyHandler.ensureNotCancelled(targetId);
        target.applyInPlace(targetId, submission);
        return DeploymentOutcome.succeeded(strategy(), null, "Applied in place");
    }
}
