package com.keystone.core.persistence;

import com.keystone.core.error.InvalidSubmissionStateException;
import com.keystone.core.error.UnknownSubmissionException;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Snapshot;
import com.keystone.core.model.Submission;
import com.keystone.core.model.SubmissionStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable record of submissions, quality reports, integration attempts and snapshots.
 * <p>
 * Reports are append-only. Attempts are saved whole on every state change.
 */
public interface PipelineStore {

    void saveSubmission(Submission submission);

    /**
     * Move a submission to a new status.
     *
     * @throws UnknownSubmissionException      if no such submission exists
     * @throws InvalidSubmissionStateException if the submission is already terminal
     */
    default Submission updateSubmissionStatus(String submissionId, SubmissionStatus status, String reason) {
        return transitionSubmission(submissionId, SubmissionStatus.nonTerminal(), status, reason);
    }

    /**
     * Move a submission to a new status only if its current status is one of {@code expected}.
     * The check and the write are atomic with respect to other transitions.
     *
     * @throws UnknownSubmissionException      if no such submission exists
     * @throws InvalidSubmissionStateException if the current status is not in {@code expected}
     */
    Submission transitionSubmission(String submissionId, Set<SubmissionStatus> expected,
                                    SubmissionStatus status, String reason);

    Optional<Submission> findSubmission(String submissionId);

    List<Submission> submissionsForProject(String projectId);

    void saveReport(QualityReport report);

    Optional<QualityReport> latestReport(String submissionId);

    /** Reports for a submission, oldest first. */
    List<QualityReport> reportsFor(String submissionId);

    /** Insert or replace an attempt by id. */
    void saveAttempt(IntegrationAttempt attempt);

    Optional<IntegrationAttempt> findAttempt(String attemptId);

    Optional<IntegrationAttempt> latestAttempt(String submissionId);

    /** Attempts for a submission, oldest first. */
    List<IntegrationAttempt> attemptsFor(String submissionId);

    void saveSnapshot(Snapshot snapshot);

    Optional<Snapshot> findSnapshot(String snapshotId);

    /** Snapshots for a target, lowest version first. */
    List<Snapshot> listSnapshots(String targetId);

    List<Snapshot> listAllSnapshots();

    boolean deleteSnapshot(String snapshotId);
}
