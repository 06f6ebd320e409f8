package com.keystone.core.deploy;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.AgentUnavailableException;
import com.keystone.core.model.AgentTask;
import com.keystone.core.model.DispatchResult;
import com.keystone.core.model.Submission;
import com.keystone.core.orchestrator.AgentOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Runs smoke checks by dispatching a task to an agent with the smoke-test capability.
 * <p>
 * The agent's result may carry {@code passed: false}. A missing smoke agent fails the
 * check unless {@code keystone.deploy.require-smoke-agent} is off.
 */
@Component
public class SmokeCheckRunner {

    private static final Logger log = LoggerFactory.getLogger(SmokeCheckRunner.class);

    public record SmokeResult(boolean passed, String agentId, String detail) {}

    private final AgentOrchestrator orchestrator;
    private final KeystoneProperties.Deploy config;

    public SmokeCheckRunner(AgentOrchestrator orchestrator, KeystoneProperties properties) {
        this.orchestrator = orchestrator;
        this.config = properties.getDeploy();
    }

    /**
     * @param environmentId environment to probe; {@code null} for the active one
     * @param phase         label sent to the agent, e.g. "standby" or "post-deploy"
     */
    public SmokeResult run(Submission submission, String targetId, String environmentId, String phase) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("submissionId", submission.id());
        payload.put("projectId", submission.projectId());
        payload.put("targetId", targetId);
        payload.put("phase", phase);
        if (environmentId != null) {
            payload.put("environmentId", environmentId);
        }
        AgentTask task = new AgentTask(UUID.randomUUID().toString(), config.getSmokeCapability(), payload, null);

        try {
            DispatchResult result = orchestrator.dispatch(task);
            Object passed = result.response().result().get("passed");
            if (Boolean.FALSE.equals(passed) || "false".equals(passed)) {
                String detail = String.valueOf(result.response().result().getOrDefault("detail", "smoke check failed"));
                log.warn("Smoke check ({}) on {} failed via agent {}: {}", phase, targetId, result.agentId(), detail);
                return new SmokeResult(false, result.agentId(), detail);
            }
            return new SmokeResult(true, result.agentId(), "smoke check passed");
        } catch (AgentUnavailableException e) {
            if (!config.isRequireSmokeAgent()) {
                log.warn("No smoke-test agent available for {}; skipping smoke check ({})", targetId, phase);
                return new SmokeResult(true, null, "skipped: no smoke-test agent");
            }
            return new SmokeResult(false, null, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Smoke check ({}) on {} errored: {}", phase, targetId, e.getMessage());
            return new SmokeResult(false, null, e.getMessage());
        }
    }
}
