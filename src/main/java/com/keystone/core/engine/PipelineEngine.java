package com.keystone.core.engine;

import com.keystone.core.error.InvalidSubmissionStateException;
import com.keystone.core.error.UnknownSubmissionException;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.EventTypes;
import com.keystone.core.events.PipelineEvent;
import com.keystone.core.integration.ProjectIntegrator;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.IssueSeverity;
import com.keystone.core.model.ProjectQualitySummary;
import com.keystone.core.model.QualityIssue;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Submission;
import com.keystone.core.model.SubmissionStatus;
import com.keystone.core.model.SubmissionStatusView;
import com.keystone.core.model.Verdict;
import com.keystone.core.notify.NotificationPublisher;
import com.keystone.core.notify.PipelineNotification;
import com.keystone.core.persistence.PipelineStore;
import com.keystone.core.quality.QualityVerificationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for external collaborators: submission intake, verification,
 * integration, cancellation and status queries.
 * <p>
 * Intake returns at once and verification runs on the pipeline pool. At most one
 * verification per submission is in flight; callers asking for the report join it.
 * Integration waits for any in-flight verification so an attempt is never created
 * while its report is still being produced.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

    private final PipelineStore store;
    private final QualityVerificationEngine quality;
    private final ProjectIntegrator integrator;
    private final NotificationPublisher notifications;
    private final EventBus eventBus;
    private final ExecutorService executor;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<QualityReport>> verifications = new ConcurrentHashMap<>();

    public PipelineEngine(PipelineStore store, QualityVerificationEngine quality, ProjectIntegrator integrator,
                          NotificationPublisher notifications, EventBus eventBus,
                          @Qualifier("pipelineExecutor") ExecutorService executor, Clock clock) {
        this.store = store;
        this.quality = quality;
        this.integrator = integrator;
        this.notifications = notifications;
        this.eventBus = eventBus;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Accept an artifact for a project and start verifying it in the background.
     *
     * @return the stored submission, status RECEIVED
     */
    public Submission submit(String projectId, Map<String, String> files, Map<String, Object> metadata) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        Instant now = clock.instant();
        Submission submission = new Submission(UUID.randomUUID().toString(), projectId, new Artifact(files),
                metadata, SubmissionStatus.RECEIVED, null, now, now);
        store.saveSubmission(submission);
        log.info("Received submission {} for project {} ({} files)", submission.id(), projectId,
                submission.artifact().fileCount());
        eventBus.publish(new PipelineEvent(EventTypes.SUBMISSION_RECEIVED, submission.id(), null,
                Map.of("projectId", projectId), now));
        startVerification(submission.id());
        return submission;
    }

    public QualityReport verifySubmission(String submissionId) {
        return verifySubmission(submissionId, false);
    }

    /**
     * Return the submission's quality report, joining an in-flight verification if
     * there is one and running verification when there is no report yet.
     *
     * @param force produce a fresh report even if one exists
     */
    public QualityReport verifySubmission(String submissionId, boolean force) {
        Submission submission = require(submissionId);
        CompletableFuture<QualityReport> running = verifications.get(submissionId);
        if (running != null) {
            return await(running);
        }
        if (!force) {
            var latest = store.latestReport(submissionId);
            if (latest.isPresent()) {
                return latest.get();
            }
        }
        if (submission.status().isTerminal() || submission.status() == SubmissionStatus.INTEGRATING) {
            throw new InvalidSubmissionStateException(
                    "Submission " + submissionId + " is " + submission.status() + " and cannot be re-verified");
        }
        return await(startVerification(submissionId));
    }

    /** Run an integration attempt to completion. */
    public IntegrationAttempt integrateSubmission(String submissionId, DeploymentStrategy strategyHint) {
        require(submissionId);
        awaitVerification(submissionId);
        return integrator.integrate(submissionId, strategyHint);
    }

    /**
     * Open an attempt and run it on the pipeline pool.
     *
     * @return the PENDING attempt
     * @throws InvalidSubmissionStateException if verification is still running
     */
    public IntegrationAttempt startIntegration(String submissionId, DeploymentStrategy strategyHint) {
        require(submissionId);
        if (verifications.containsKey(submissionId)) {
            throw new InvalidSubmissionStateException("Submission " + submissionId + " is still being verified");
        }
        IntegrationAttempt attempt = integrator.open(submissionId, strategyHint);
        CompletableFuture.runAsync(() -> integrator.run(attempt), executor)
                .exceptionally(e -> {
                    log.error("Integration attempt {} crashed: {}", attempt.id(), e.getMessage(), e);
                    return null;
                });
        return attempt;
    }

    /**
     * Cancel the submission's current attempt if it has not started deploying.
     */
    public boolean cancelIntegration(String submissionId) {
        require(submissionId);
        return store.latestAttempt(submissionId)
                .filter(a -> !a.state().isTerminal())
                .map(a -> integrator.cancel(a.id()))
                .orElse(false);
    }

    public SubmissionStatusView getStatus(String submissionId) {
        Submission submission = require(submissionId);
        return new SubmissionStatusView(submission,
                store.latestReport(submissionId).orElse(null),
                store.latestAttempt(submissionId).orElse(null));
    }

    public ProjectQualitySummary projectQuality(String projectId) {
        List<Submission> submissions = store.submissionsForProject(projectId);
        List<QualityReport> reports = new ArrayList<>();
        int integrated = 0;
        int rolledBack = 0;
        int failed = 0;
        for (Submission s : submissions) {
            reports.addAll(store.reportsFor(s.id()));
            for (IntegrationAttempt a : store.attemptsFor(s.id())) {
                switch (a.state()) {
                    case COMPLETED -> integrated++;
                    case ROLLED_BACK -> rolledBack++;
                    case FAILED -> failed++;
                    default -> { }
                }
            }
        }
        int accepted = (int) reports.stream().filter(r -> r.verdict() == Verdict.ACCEPT).count();
        double average = reports.stream().mapToDouble(r -> r.weightedScore().doubleValue()).average().orElse(0.0);
        Map<IssueSeverity, Long> bySeverity = new EnumMap<>(IssueSeverity.class);
        for (QualityReport r : reports) {
            for (QualityIssue i : r.issues()) {
                bySeverity.merge(i.severity(), 1L, Long::sum);
            }
        }
        double approvalRate = reports.isEmpty() ? 0.0 : (double) accepted / reports.size();
        return new ProjectQualitySummary(projectId, submissions.size(), reports.size(), accepted,
                reports.size() - accepted, approvalRate, average, bySeverity, integrated, rolledBack, failed);
    }

    private CompletableFuture<QualityReport> startVerification(String submissionId) {
        CompletableFuture<QualityReport> created = new CompletableFuture<>();
        CompletableFuture<QualityReport> existing = verifications.putIfAbsent(submissionId, created);
        if (existing != null) {
            return existing;
        }
        executor.execute(() -> {
            try {
                created.complete(runVerification(submissionId));
            } catch (Exception e) {
                log.error("Verification of submission {} failed: {}", submissionId, e.getMessage(), e);
                created.completeExceptionally(e);
            } finally {
                verifications.remove(submissionId, created);
            }
        });
        return created;
    }

    private QualityReport runVerification(String submissionId) {
        Submission submission = require(submissionId);
        MdcContext.setSubmission(submissionId, submission.projectId());
        try {
            submission = store.transitionSubmission(submissionId, SubmissionStatus.verifiable(),
                    SubmissionStatus.VERIFYING, null);
            eventBus.publish(new PipelineEvent(EventTypes.VERIFICATION_STARTED, submissionId, null, Map.of(),
                    clock.instant()));

            QualityReport report = quality.verify(submission);

            SubmissionStatus outcome = report.isAccepted() ? SubmissionStatus.ACCEPTED : SubmissionStatus.REJECTED;
            store.transitionSubmission(submissionId, Set.of(SubmissionStatus.VERIFYING), outcome, report.summary());
            eventBus.publish(new PipelineEvent(EventTypes.VERIFICATION_COMPLETED, submissionId, null,
                    Map.of("verdict", report.verdict().name(),
                            "score", report.weightedScore().doubleValue(),
                            "issues", report.issues().size()),
                    clock.instant()));
            notifications.publish(new PipelineNotification("verification", submissionId, null, outcome.name(),
                    report.summary(),
                    report.issues().stream().map(i -> i.severity() + " " + i.category() + ": " + i.description()).toList(),
                    false, clock.instant()));
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private void awaitVerification(String submissionId) {
        CompletableFuture<QualityReport> running = verifications.get(submissionId);
        if (running != null) {
            await(running);
        }
    }

    private Submission require(String submissionId) {
        return store.findSubmission(submissionId).orElseThrow(() -> new UnknownSubmissionException(submissionId));
    }

    private static QualityReport await(CompletableFuture<QualityReport> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
