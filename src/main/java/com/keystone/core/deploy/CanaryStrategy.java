package com.keystone.core.deploy;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.DeploymentFailureException;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.Submission;
import com.keystone.core.resilience.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Routes a slice of traffic to the new artifact and samples its error rate and
 * latency across the monitoring window.
 * <p>
 * A sample over either limit reverts routing to 0% at once, tears the canary down
 * and asks for a rollback. A clean window ramps to 100% and promotes the canary.
 */
@Component
public class CanaryStrategy implements DeploymentStrategyHandler {

    private static final Logger log = LoggerFactory.getLogger(CanaryStrategy.class);

    private final DeploymentTarget target;
    private final Sleeper sleeper;
    private final KeystoneProperties.Deploy config;

    public CanaryStrategy(DeploymentTarget target, Sleeper sleeper, KeystoneProperties properties) {
        this.target = target;
        this.sleeper = sleeper;
        this.config = properties.getDeploy();
    }

    @Override
    public DeploymentStrategy strategy() {
        return DeploymentStrategy.CANARY;
    }

    @Override
    public DeploymentOutcome deploy(Submission submission, String targetId) {
        String env = target.provisionStandby(targetId, submission);
        abortIfCancelled(targetId, env);
        target.routeTraffic(targetId, env, config.getCanaryPercent());
        log.info("Canary {} for {} receiving {}% of traffic", env, targetId, config.getCanaryPercent());

        Duration interval = config.getCanarySampleInterval();
        long samples = Math.max(1, config.getCanaryWindow().toMillis() / Math.max(1, interval.toMillis()));
        List<CanaryMetrics> observations = new ArrayList<>();

        for (long i = 0; i < samples; i++) {
            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                revert(targetId, env);
                throw new DeploymentFailureException("Canary on " + targetId + " interrupted", e);
            }
            CanaryMetrics sample = target.sample(targetId, env);
            observations.add(sample);
            String breach = breach(sample);
            if (breach != null) {
                revert(targetId, env);
                log.warn("Canary {} for {} breached limits: {}", env, targetId, breach);
                return new DeploymentOutcome(strategy(), false, true, env,
                        "Canary reverted: " + breach, observations);
            }
        }

        abortIfCancelled(targetId, env);
        target.routeTraffic(targetId, env, 100);
        target.switchTraffic(targetId, env);
        log.info("Canary {} for {} promoted after {} clean samples", env, targetId, observations.size());
        return new DeploymentOutcome(strategy(), true, false, env, "Promoted after clean window", observations);
    }

    private String breach(CanaryMetrics sample) {
        if (sample.errorRate() > config.getCanaryMaxErrorRate()) {
            return String.format(Locale.ROOT, "error rate %.2f%% over %.2f%%",
                    sample.errorRate() * 100, config.getCanaryMaxErrorRate() * 100);
        }
        if (sample.p95LatencyMs() > config.getCanaryMaxLatencyMs()) {
            return "p95 latency " + sample.p95LatencyMs() + " ms over " + config.getCanaryMaxLatencyMs() + " ms";
        }
        return null;
    }

    private void abortIfCancelled(String targetId, String env) {
        try {
            DeploymentStrategyHandler.ensureNotCancelled(targetId);
        } catch (DeploymentFailureException e) {
            revert(targetId, env);
            throw e;
        }
    }

    private void revert(String targetId, String env) {
        target.routeTraffic(targetId, env, 0);
        target.teardown(targetId, env);
    }
}
