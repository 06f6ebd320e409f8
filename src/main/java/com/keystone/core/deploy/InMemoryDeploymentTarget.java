package com.keystone.core.deploy;

import com.keystone.core.error.DeploymentFailureException;
import com.keystone.core.model.Submission;
import com.keystone.core.model.TargetState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Process-local deployment target used when no external environment is wired in.
 * Keeps the active state, any standby environments and the canary routing split
 * per target id.
 */
public class InMemoryDeploymentTarget implements DeploymentTarget {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeploymentTarget.class);

    private final ConcurrentHashMap<String, TargetState> active = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TargetState> standby = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Integer> routing = new ConcurrentHashMap<>();
    private final BiFunction<String, String, CanaryMetrics> sampler;

    public InMemoryDeploymentTarget() {
        this((target, env) -> CanaryMetrics.healthy());
    }

    public InMemoryDeploymentTarget(BiFunction<String, String, CanaryMetrics> sampler) {
        this.sampler = sampler;
    }

    @Override
    public TargetState capture(String targetId) {
        return active.getOrDefault(targetId, TargetState.empty(targetId));
    }

    @Override
    public void restore(TargetState state) {
        active.put(state.targetId(), state);
        routing.remove(state.targetId());
        log.info("Target {} restored to revision {}", state.targetId(), state.revision());
    }

    @Override
    public void applyInPlace(String targetId, Submission submission) {
        active.compute(targetId, (id, current) -> {
            TargetState base = current != null ? current : TargetState.empty(id);
            return new TargetState(id, base.revision() + 1, submission.id(),
                    submission.artifact().files(), base.activeEnvironment());
        });
    }

    @Override
    public String provisionStandby(String targetId, Submission submission) {
        TargetState current = capture(targetId);
        String env = "blue".equals(current.activeEnvironment()) ? "green" : "blue";
        standby.put(key(targetId, env), new TargetState(targetId, current.revision() + 1, submission.id(),
                submission.artifact().files(), env));
        log.debug("Provisioned {} environment for target {}", env, targetId);
        return env;
    }

    @Override
    public void switchTraffic(String targetId, String environmentId) {
        TargetState next = standby.remove(key(targetId, environmentId));
        if (next == null) {
            throw new DeploymentFailureException("No " + environmentId + " environment provisioned for " + targetId);
        }
        active.put(targetId, next);
        routing.remove(targetId);
    }

    @Override
    public void teardown(String targetId, String environmentId) {
        standby.remove(key(targetId, environmentId));
        routing.remove(targetId);
    }

    @Override
    public void routeTraffic(String targetId, String environmentId, int percent) {
        if (!standby.containsKey(key(targetId, environmentId))) {
            throw new DeploymentFailureException("No " + environmentId + " environment provisioned for " + targetId);
        }
        routing.put(targetId, percent);
    }

    @Override
    public CanaryMetrics sample(String targetId, String environmentId) {
        return sampler.apply(targetId, environmentId);
    }

    /** Share of traffic currently routed to a standby environment. */
    public int routedPercent(String targetId) {
        return routing.getOrDefault(targetId, 0);
    }

    public Map<String, TargetState> standbyEnvironments() {
        return Map.copyOf(standby);
    }

    private static String key(String targetId, String env) {
        return targetId + "/" + env;
    }
}
