package com.keystone.core.deploy;

/**
 * Health figures observed on the canary slice during one sample interval.
 */
public record CanaryMetrics(double errorRate, long p95LatencyMs, long requests) {

    public static CanaryMetrics healthy() {
        return new CanaryMetrics(0.0, 0L, 0L);
    }
}
