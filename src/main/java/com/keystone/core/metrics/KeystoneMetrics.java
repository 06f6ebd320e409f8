package com.keystone.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the pipeline.
 */
@Service
public class KeystoneMetrics {

    private final MeterRegistry registry;

    public KeystoneMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatch(String capability, String outcome, long ms) {
        Timer.builder("keystone.dispatch.duration")
                .tag("capability", capability)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetryAttempt(String agentId) {
        Counter.builder("keystone.retry.attempts")
                .description("Retried agent calls")
                .tag("agent", agentId)
                .register(registry)
                .increment();
    }

    public void recordCircuitTransition(String from, String to) {
        Counter.builder("keystone.circuit.transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordVerdict(String verdict, double score) {
        Counter.builder("keystone.quality.verdicts")
                .tag("verdict", verdict)
                .register(registry)
                .increment();
        DistributionSummary.builder("keystone.quality.score")
                .description("Weighted quality score per report")
                .register(registry)
                .record(score);
    }

    public void recordIntegrationResult(String strategy, String state) {
        Counter.builder("keystone.integration.results")
                .tag("strategy", strategy)
                .tag("state", state)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success" or "failure"
     */
    public void recordRollback(String outcome) {
        Counter.builder("keystone.rollback.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
