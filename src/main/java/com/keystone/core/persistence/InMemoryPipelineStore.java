package com.keystone.core.persistence;

import com.keystone.core.error.InvalidSubmissionStateException;
import com.keystone.core.error.UnknownSubmissionException;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Snapshot;
import com.keystone.core.model.Submission;
import com.keystone.core.model.SubmissionStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local {@link PipelineStore}. State is lost on restart.
 */
public class InMemoryPipelineStore implements PipelineStore {

    private final Clock clock;
    private final ConcurrentHashMap<String, Submission> submissions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<QualityReport>> reports = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, IntegrationAttempt> attempts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<String>> attemptOrder = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    public InMemoryPipelineStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void saveSubmission(Submission submission) {
        submissions.put(submission.id(), submission);
    }

    @Override
    public Submission transitionSubmission(String submissionId, Set<SubmissionStatus> expected,
                                           SubmissionStatus status, String reason) {
        Submission updated = submissions.computeIfPresent(submissionId, (id, current) -> {
            if (!expected.contains(current.status())) {
                throw new InvalidSubmissionStateException(
                        "Submission " + id + " is " + current.status() + " and cannot move to " + status);
            }
            return current.withStatus(status, reason, clock.instant());
        });
        if (updated == null) {
            throw new UnknownSubmissionException(submissionId);
        }
        return updated;
    }

    @Override
    public Optional<Submission> findSubmission(String submissionId) {
        return Optional.ofNullable(submissions.get(submissionId));
    }

    @Override
    public List<Submission> submissionsForProject(String projectId) {
        return submissions.values().stream()
                .filter(s -> s.projectId().equals(projectId))
                .sorted(Comparator.comparing(Submission::createdAt).thenComparing(Submission::id))
                .toList();
    }

    @Override
    public void saveReport(QualityReport report) {
        reports.computeIfAbsent(report.submissionId(), k -> new CopyOnWriteArrayList<>()).add(report);
    }

    @Override
    public Optional<QualityReport> latestReport(String submissionId) {
        List<QualityReport> list = reports.get(submissionId);
        return list == null || list.isEmpty() ? Optional.empty() : Optional.of(list.get(list.size() - 1));
    }

    @Override
    public List<QualityReport> reportsFor(String submissionId) {
        List<QualityReport> list = reports.get(submissionId);
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public void saveAttempt(IntegrationAttempt attempt) {
        if (attempts.put(attempt.id(), attempt) == null) {
            attemptOrder.computeIfAbsent(attempt.submissionId(), k -> new CopyOnWriteArrayList<>()).add(attempt.id());
        }
    }

    @Override
    public Optional<IntegrationAttempt> findAttempt(String attemptId) {
        return Optional.ofNullable(attempts.get(attemptId));
    }

    @Override
    public Optional<IntegrationAttempt> latestAttempt(String submissionId) {
        List<IntegrationAttempt> all = attemptsFor(submissionId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    @Override
    public List<IntegrationAttempt> attemptsFor(String submissionId) {
        List<String> ids = attemptOrder.get(submissionId);
        if (ids == null) {
            return List.of();
        }
        List<IntegrationAttempt> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            IntegrationAttempt a = attempts.get(id);
            if (a != null) {
                result.add(a);
            }
        }
        return result;
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        snapshots.put(snapshot.id(), snapshot);
    }

    @Override
    public Optional<Snapshot> findSnapshot(String snapshotId) {
        return Optional.ofNullable(snapshots.get(snapshotId));
    }

    @Override
    public List<Snapshot> listSnapshots(String targetId) {
        return snapshots.values().stream()
                .filter(s -> s.targetId().equals(targetId))
                .sorted(Comparator.comparingLong(Snapshot::version))
                .toList();
    }

    @Override
    public List<Snapshot> listAllSnapshots() {
        return snapshots.values().stream()
                .sorted(Comparator.comparing(Snapshot::targetId).thenComparingLong(Snapshot::version))
                .toList();
    }

    @Override
    public boolean deleteSnapshot(String snapshotId) {
        return snapshots.remove(snapshotId) != null;
    }
}
