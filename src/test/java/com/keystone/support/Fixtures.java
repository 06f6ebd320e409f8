package com.keystone.support;

import com.keystone.core.model.Artifact;
import com.keystone.core.model.CheckerResult;
import com.keystone.core.model.QualityIssue;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Submission;
import com.keystone.core.model.SubmissionStatus;
import com.keystone.core.model.Verdict;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Builders for domain objects used across tests. */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private Fixtures() {
    }

    public static Submission submission(String id, String projectId, Map<String, String> files) {
        return submission(id, projectId, files, Map.of(), SubmissionStatus.RECEIVED);
    }

    public static Submission submission(String id, String projectId, Map<String, String> files,
                                        Map<String, Object> metadata, SubmissionStatus status) {
        return new Submission(id, projectId, new Artifact(files), metadata, status, null, T0, T0);
    }

    public static Submission submission(Map<String, String> files) {
        return submission("sub-1", "proj-1", files);
    }

    public static QualityReport report(String submissionId, Verdict verdict, List<QualityIssue> issues) {
        return new QualityReport("rep-" + submissionId, submissionId,
                List.of(CheckerResult.of("code-quality", 95.0, issues)),
                new BigDecimal("95.0000"), verdict, issues, verdict.name(), T0);
    }
}
