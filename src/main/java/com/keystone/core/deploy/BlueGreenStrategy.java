package com.keystone.core.deploy;

import com.keystone.core.error.DeploymentFailureException;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deploys into the idle environment, smoke-checks it, then switches traffic.
 * A failure before the switch tears the idle environment down and leaves the
 * active one untouched, so no restore is needed.
 */
@Component
public class BlueGreenStrategy implements DeploymentStrategyHandler {

    private static final Logger log = LoggerFactory.getLogger(BlueGreenStrategy.class);

    private final DeploymentTarget target;
    private final SmokeCheckRunner smokeChecks;

    public BlueGreenStrategy(DeploymentTarget target, SmokeCheckRunner smokeChecks) {
        this.target = target;
        this.smokeChecks = smokeChecks;
    }

    @Override
    public DeploymentStrategy strategy() {
        return DeploymentStrategy.BLUE_GREEN;
    }

    @Override
    public DeploymentOutcome deploy(Submission submission, String targetId) {
        String env = null;
        try {
            env = target.provisionStandby(targetId, submission);
            var smoke = smokeChecks.run(submission, targetId, env, "standby");
            if (!smoke.passed()) {
                target.teardown(targetId, env);
                log.info("Standby {} for {} failed smoke check and was torn down", env, targetId);
                return DeploymentOutcome.failedClean(strategy(), env,
                        "Smoke check on " + env + " failed: " + smoke.detail());
            }
        } catch (RuntimeException e) {
            if (env != null) {
                target.teardown(targetId, env);
            }
            return DeploymentOutcome.failedClean(strategy(), env, "Standby preparation failed: " + e.getMessage());
        }

        try {
            DeploymentStrategyHandler.ensureNotCancelled(targetId);
        } catch (DeploymentFailureException e) {
            target.teardown(targetId, env);
            throw e;
        }
        target.switchTraffic(targetId, env);
        log.info("Traffic for {} switched to {}", targetId, env);
        return DeploymentOutcome.succeeded(strategy(), env, "Switched traffic to " + env);
    }
}
