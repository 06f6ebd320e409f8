package com.keystone.core.config;

import com.keystone.core.model.DeploymentStrategy;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Configuration properties for the integration pipeline.
 * <p>
 * Binds {@code keystone.*} from application.yml / environment variables.
 *
 * <pre>
 * keystone:
 *   resilience:
 *     failure-threshold: 5
 *     base-cooldown: 30s
 *   quality:
 *     threshold: 85
 *     weights:
 *       code-quality: 0.35
 *       security: 0.30
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "keystone")
public class KeystoneProperties {

    private static final Logger log = LoggerFactory.getLogger(KeystoneProperties.class);
    private static final double WEIGHT_TOLERANCE = 1e-6;

    private Resilience resilience = new Resilience();
    private Registry registry = new Registry();
    private Quality quality = new Quality();
    private Deploy deploy = new Deploy();
    private Rollback rollback = new Rollback();
    private Integration integration = new Integration();

    @PostConstruct
    public void validate() {
        double sum = quality.getWeights().values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException(
                    "keystone.quality.weights must sum to 1.0 but sum to " + sum + ": " + quality.getWeights());
        }
        if (quality.getWeights().values().stream().anyMatch(w -> w < 0.0)) {
            throw new IllegalStateException("keystone.quality.weights must be non-negative: " + quality.getWeights());
        }
        Set<String> enabled = new TreeSet<>(quality.getEnabledCheckers());
        if (!enabled.equals(new TreeSet<>(quality.getWeights().keySet()))) {
            throw new IllegalStateException("keystone.quality.enabled-checkers " + enabled
                    + " must name exactly the checkers in keystone.quality.weights " + quality.getWeights().keySet());
        }
        if (quality.getThreshold() < 0 || quality.getThreshold() > 100) {
            throw new IllegalStateException("keystone.quality.threshold must be within [0,100]");
        }
        if (resilience.getFailureThreshold() < 1) {
            throw new IllegalStateException("keystone.resilience.failure-threshold must be at least 1");
        }
        if (deploy.getCanaryPercent() < 1 || deploy.getCanaryPercent() > 99) {
            throw new IllegalStateException("keystone.deploy.canary-percent must be within [1,99]");
        }
        log.info("Quality gate: threshold {} with weights {}", quality.getThreshold(), quality.getWeights());
    }

    public Resilience getResilience() { return resilience; }
    public void setResilience(Resilience resilience) { this.resilience = resilience; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }
    public Quality getQuality() { return quality; }
    public void setQuality(Quality quality) { this.quality = quality; }
    public Deploy getDeploy() { return deploy; }
    public void setDeploy(Deploy deploy) { this.deploy = deploy; }
    public Rollback getRollback() { return rollback; }
    public void setRollback(Rollback rollback) { this.rollback = rollback; }
    public Integration getIntegration() { return integration; }
    public void setIntegration(Integration integration) { this.integration = integration; }

    public static class Resilience {
        private int failureThreshold = 5;
        private Duration baseCooldown = Duration.ofSeconds(30);
        private Duration maxCooldown = Duration.ofMinutes(10);
        private int maxRetries = 3;
        private Duration retryBaseDelay = Duration.ofMillis(200);
        private Duration retryMaxDelay = Duration.ofSeconds(5);
        private double jitter = 0.2;
        private Duration callTimeout = Duration.ofSeconds(30);

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getBaseCooldown() { return baseCooldown; }
        public void setBaseCooldown(Duration baseCooldown) { this.baseCooldown = baseCooldown; }
        public Duration getMaxCooldown() { return maxCooldown; }
        public void setMaxCooldown(Duration maxCooldown) { this.maxCooldown = maxCooldown; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getRetryBaseDelay() { return retryBaseDelay; }
        public void setRetryBaseDelay(Duration retryBaseDelay) { this.retryBaseDelay = retryBaseDelay; }
        public Duration getRetryMaxDelay() { return retryMaxDelay; }
        public void setRetryMaxDelay(Duration retryMaxDelay) { this.retryMaxDelay = retryMaxDelay; }
        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }
        public Duration getCallTimeout() { return callTimeout; }
        public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
    }

    public static class Registry {
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        /** Missed intervals per health step: N gives DEGRADED, 2N gives UNREACHABLE. */
        private int missedHeartbeats = 3;
        private Duration unreachableTtl = Duration.ofMinutes(30);
        private Duration probeTimeout = Duration.ofSeconds(5);
        private int defaultMaxLoad = 10;

        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public int getMissedHeartbeats() { return missedHeartbeats; }
        public void setMissedHeartbeats(int missedHeartbeats) { this.missedHeartbeats = missedHeartbeats; }
        public Duration getUnreachableTtl() { return unreachableTtl; }
        public void setUnreachableTtl(Duration unreachableTtl) { this.unreachableTtl = unreachableTtl; }
        public Duration getProbeTimeout() { return probeTimeout; }
        public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
        public int getDefaultMaxLoad() { return defaultMaxLoad; }
        public void setDefaultMaxLoad(int defaultMaxLoad) { this.defaultMaxLoad = defaultMaxLoad; }
    }

    public static class Quality {
        private double threshold = 85.0;
        private Map<String, Double> weights = defaultWeights();
        private Duration checkerTimeout = Duration.ofSeconds(60);
        private List<String> enabledCheckers = new ArrayList<>(List.of(
                "code-quality", "security", "performance", "documentation"));

        private static Map<String, Double> defaultWeights() {
            Map<String, Double> w = new LinkedHashMap<>();
            w.put("code-quality", 0.35);
            w.put("security", 0.30);
            w.put("performance", 0.20);
            w.put("documentation", 0.15);
            return w;
        }

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
        public Map<String, Double> getWeights() { return weights; }
        public void setWeights(Map<String, Double> weights) { this.weights = weights; }
        public Duration getCheckerTimeout() { return checkerTimeout; }
        public void setCheckerTimeout(Duration checkerTimeout) { this.checkerTimeout = checkerTimeout; }
        public List<String> getEnabledCheckers() { return enabledCheckers; }
        public void setEnabledCheckers(List<String> enabledCheckers) { this.enabledCheckers = enabledCheckers; }
    }

    public static class Deploy {
        private int canaryPercent = 10;
        private Duration canaryWindow = Duration.ofMinutes(5);
        private Duration canarySampleInterval = Duration.ofSeconds(30);
        private double canaryMaxErrorRate = 0.05;
        private long canaryMaxLatencyMs = 1500;
        private String smokeCapability = "smoke-test";
        private boolean requireSmokeAgent = true;
        private Duration stepTimeout = Duration.ofMinutes(10);
        private Duration cancelGrace = Duration.ofSeconds(30);

        public int getCanaryPercent() { return canaryPercent; }
        public void setCanaryPercent(int canaryPercent) { this.canaryPercent = canaryPercent; }
        public Duration getCanaryWindow() { return canaryWindow; }
        public void setCanaryWindow(Duration canaryWindow) { this.canaryWindow = canaryWindow; }
        public Duration getCanarySampleInterval() { return canarySampleInterval; }
        public void setCanarySampleInterval(Duration canarySampleInterval) { this.canarySampleInterval = canarySampleInterval; }
        public double getCanaryMaxErrorRate() { return canaryMaxErrorRate; }
        public void setCanaryMaxErrorRate(double canaryMaxErrorRate) { this.canaryMaxErrorRate = canaryMaxErrorRate; }
        public long getCanaryMaxLatencyMs() { return canaryMaxLatencyMs; }
        public void setCanaryMaxLatencyMs(long canaryMaxLatencyMs) { this.canaryMaxLatencyMs = canaryMaxLatencyMs; }
        public String getSmokeCapability() { return smokeCapability; }
        public void setSmokeCapability(String smokeCapability) { this.smokeCapability = smokeCapability; }
        public boolean isRequireSmokeAgent() { return requireSmokeAgent; }
        public void setRequireSmokeAgent(boolean requireSmokeAgent) { this.requireSmokeAgent = requireSmokeAgent; }
        public Duration getStepTimeout() { return stepTimeout; }
        public void setStepTimeout(Duration stepTimeout) { this.stepTimeout = stepTimeout; }
        public Duration getCancelGrace() { return cancelGrace; }
        public void setCancelGrace(Duration cancelGrace) { this.cancelGrace = cancelGrace; }
    }

    public static class Rollback {
        private Duration retention = Duration.ofDays(7);
        private Duration rolledBackRetention = Duration.ofDays(30);
        private Duration pruneInterval = Duration.ofHours(1);

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
        public Duration getRolledBackRetention() { return rolledBackRetention; }
        public void setRolledBackRetention(Duration rolledBackRetention) { this.rolledBackRetention = rolledBackRetention; }
        public Duration getPruneInterval() { return pruneInterval; }
        public void setPruneInterval(Duration pruneInterval) { this.pruneInterval = pruneInterval; }
    }

    public static class Integration {
        private DeploymentStrategy defaultStrategy = DeploymentStrategy.BLUE_GREEN;
        private boolean forceBlueGreenOnRetry = true;

        public DeploymentStrategy getDefaultStrategy() { return defaultStrategy; }
        public void setDefaultStrategy(DeploymentStrategy defaultStrategy) { this.defaultStrategy = defaultStrategy; }
        public boolean isForceBlueGreenOnRetry() { return forceBlueGreenOnRetry; }
        public void setForceBlueGreenOnRetry(boolean forceBlueGreenOnRetry) { this.forceBlueGreenOnRetry = forceBlueGreenOnRetry; }
    }
}
