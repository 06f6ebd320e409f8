package com.keystone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.QualityIssue;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.SubmissionStatusView;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON response for submission endpoints.
 */
public record SubmissionResponse(
    @JsonProperty("submission_id") String submissionId,
    @JsonProperty("project_id") String projectId,
    String status,
    String reason,
    @JsonProperty("created_at") Instant createdAt,
    ReportSummary report,
    AttemptSummary attempt
) {

    public record ReportSummary(
        @JsonProperty("report_id") String reportId,
        String verdict,
        @JsonProperty("weighted_score") BigDecimal weightedScore,
        @JsonProperty("checker_scores") Map<String, Double> checkerScores,
        String summary,
        List<QualityIssue> issues
    ) {

        static ReportSummary of(QualityReport report) {
            Map<String, Double> scores = new LinkedHashMap<>();
            report.checkerResults().forEach(r -> scores.put(r.checker(), r.score()));
            return new ReportSummary(report.id(), report.verdict().name(), report.weightedScore(),
                    scores, report.summary(), report.issues());
        }
    }

    public record AttemptSummary(
        @JsonProperty("attempt_id") String attemptId,
        String state,
        @JsonProperty("requested_strategy") String requestedStrategy,
        String strategy,
        @JsonProperty("snapshot_id") String snapshotId,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("ended_at") Instant endedAt,
        String reason,
        List<String> errors,
        @JsonProperty("rollback_failed") boolean rollbackFailed
    ) {

        static AttemptSummary of(IntegrationAttempt a) {
            return new AttemptSummary(a.id(), a.state().name(),
                    a.requestedStrategy() != null ? a.requestedStrategy().name() : null,
                    a.strategy().name(), a.snapshotId(), a.startedAt(), a.endedAt(), a.reason(),
                    a.errors(), a.rollbackFailed());
        }
    }

    static SubmissionResponse of(SubmissionStatusView view) {
        var s = view.submission();
        return new SubmissionResponse(s.id(), s.projectId(), s.status().name(), s.reason(), s.createdAt(),
                view.latestReport() != null ? ReportSummary.of(view.latestReport()) : null,
                view.latestAttempt() != null ? AttemptSummary.of(view.latestAttempt()) : null);
    }
}
