package com.keystone.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Aggregated verification result for one submission. Reports are append-only;
 * re-verification produces a new report.
 */
public record QualityReport(
    String id,
    String submissionId,
    List<CheckerResult> checkerResults,
    BigDecimal weightedScore,
    Verdict verdict,
    List<QualityIssue> issues,
    String summary,
    Instant createdAt
) implements Serializable {

    public QualityReport {
        checkerResults = checkerResults == null ? List.of() : List.copyOf(checkerResults);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    @JsonIgnore
    public boolean isAccepted() {
        return verdict == Verdict.ACCEPT;
    }

    public boolean hasIssueAtLeast(IssueSeverity severity) {
        return issues.stream().anyMatch(i -> i.severity().compareTo(severity) >= 0);
    }
}
