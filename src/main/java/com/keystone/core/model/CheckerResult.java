package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Output of one quality checker. A checker that crashed or timed out is
 * reported with {@code failed = true} and a score of zero.
 */
public record CheckerResult(
    String checker,
    double score,
    List<QualityIssue> issues,
    boolean failed,
    Map<String, Object> details
) implements Serializable {

    public CheckerResult {
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("checker score out of range [0,100]: " + score);
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static CheckerResult of(String checker, double score, List<QualityIssue> issues) {
        return new CheckerResult(checker, score, issues, false, Map.of());
    }

    public static CheckerResult crashed(String checker, String description) {
        return new CheckerResult(checker, 0.0,
                List.of(new QualityIssue(IssueSeverity.HIGH, "checker-failure", null, description,
                        "Investigate the checker and re-run verification")),
                true, Map.of());
    }
}
