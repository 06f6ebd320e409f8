package com.keystone.core.quality;

import com.keystone.core.model.CheckerResult;
import com.keystone.core.model.IssueSeverity;
import com.keystone.core.model.QualityIssue;
import com.keystone.core.model.Submission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grades benchmark figures the producing agent attached to the submission metadata
 * under {@code benchmark}: {@code p95LatencyMs}, {@code latencyBudgetMs},
 * {@code memoryMb} and {@code memoryBudgetMb}.
 * <p>
 * Without benchmark data the checker cannot vouch for the artifact and returns a
 * reduced score with a LOW issue.
 */
@Component
public class PerformanceChecker implements QualityChecker {

    public static final String NAME = "performance";

    static final double NO_BENCHMARK_SCORE = 80.0;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckerResult check(Submission submission) {
        Object raw = submission.metadata().get("benchmark");
        if (!(raw instanceof Map<?, ?> benchmark)) {
            return new CheckerResult(NAME, NO_BENCHMARK_SCORE,
                    List.of(new QualityIssue(IssueSeverity.LOW, "performance", null,
                            "No benchmark results supplied", "Attach benchmark metadata to the submission")),
                    false, Map.of("benchmark", false));
        }

        List<QualityIssue> issues = new ArrayList<>();
        double score = 100.0;
        Map<String, Object> details = new LinkedHashMap<>();

        Double p95 = number(benchmark.get("p95LatencyMs"));
        Double latencyBudget = number(benchmark.get("latencyBudgetMs"));
        if (p95 != null && latencyBudget != null) {
            details.put("p95LatencyMs", p95);
            if (p95 > latencyBudget) {
                issues.add(new QualityIssue(IssueSeverity.HIGH, "latency", null,
                        "p95 latency " + p95 + " ms exceeds budget " + latencyBudget + " ms",
                        "Profile the hot path"));
                score -= 30;
            }
        }

        Double memory = number(benchmark.get("memoryMb"));
        Double memoryBudget = number(benchmark.get("memoryBudgetMb"));
        if (memory != null && memoryBudget != null) {
            details.put("memoryMb", memory);
            if (memory > memoryBudget) {
                issues.add(new QualityIssue(IssueSeverity.MEDIUM, "memory", null,
                        "Memory " + memory + " MB exceeds budget " + memoryBudget + " MB",
                        "Reduce allocations or cache sizes"));
                score -= 15;
            }
        }

        return new CheckerResult(NAME, Math.max(0.0, score), issues, false, details);
    }

    private static Double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
