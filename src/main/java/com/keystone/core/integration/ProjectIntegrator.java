package com.keystone.core.integration;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.deploy.DeploymentOutcome;
import com.keystone.core.deploy.DeploymentStrategyExecutor;
import com.keystone.core.deploy.SmokeCheckRunner;
import com.keystone.core.error.DeploymentFailureException;
import com.keystone.core.error.IntegrationConflictException;
import com.keystone.core.error.KeystoneException;
import com.keystone.core.error.InvalidSubmissionStateException;
import com.keystone.core.error.RollbackFailureException;
import com.keystone.core.error.UnknownSubmissionException;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.EventTypes;
import com.keystone.core.events.PipelineEvent;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.AttemptState;
import com.keystone.core.model.DeploymentStrategy;
import com.keystone.core.model.IntegrationAttempt;
import com.keystone.core.model.IssueSeverity;
import com.keystone.core.model.QualityReport;
import com.keystone.core.model.Snapshot;
import com.keystone.core.model.Submission;
import com.keystone.core.model.SubmissionStatus;
import com.keystone.core.notify.NotificationPublisher;
import com.keystone.core.notify.PipelineNotification;
import com.keystone.core.persistence.PipelineStore;
import com.keystone.core.rollback.RollbackManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one integration attempt through
 * PENDING, VALIDATING, DEPLOYING, VERIFYING and a terminal state.
 * <p>
 * <ul>
 *   <li>VALIDATING takes the per-project lock, checks the submission is integrable and
 *       claims it by moving it to INTEGRATING in one store transition, which a concurrent
 *       re-verification cannot interleave with. Nothing here touches the target; a
 *       failure ends the attempt as FAILED.</li>
 *   <li>DEPLOYING snapshots the target, then runs the chosen strategy. A strategy that
 *       failed without touching live traffic ends as FAILED with no restore. A canary
 *       that breached its limits is restored and ends as ROLLED_BACK. A strategy that
 *       threw is restored and ends as FAILED.</li>
 *   <li>VERIFYING runs post-deploy smoke checks. Failure restores and ends as ROLLED_BACK.</li>
 *   <li>If a restore fails, or a timed-out strategy could not be stopped, the attempt ends
 *       FAILED with {@code rollbackFailed} set and an alert goes out. Later attempts for
 *       that submission are refused until an operator intervenes.</li>
 * </ul>
 * The target id of a project is its project id.
 */
@Service
public class ProjectIntegrator {

    private static final Logger log = LoggerFactory.getLogger(ProjectIntegrator.class);

    private final PipelineStore store;
    private final ProjectLockRegistry locks;
    private final RollbackManager rollbackManager;
    private final DeploymentStrategyExecutor deployer;
    private final SmokeCheckRunner smokeChecks;
    private final NotificationPublisher notifications;
    private final EventBus eventBus;
    private final KeystoneMetrics metrics;
    private final KeystoneProperties.Integration config;
    private final Clock clock;

    private final ConcurrentHashMap<String, AttemptControl> controls = new ConcurrentHashMap<>();

    public ProjectIntegrator(PipelineStore store, ProjectLockRegistry locks, RollbackManager rollbackManager,
                             DeploymentStrategyExecutor deployer, SmokeCheckRunner smokeChecks,
                             NotificationPublisher notifications, EventBus eventBus, KeystoneMetrics metrics,
                             KeystoneProperties properties, Clock clock) {
        this.store = store;
        this.locks = locks;
        this.rollbackManager = rollbackManager;
        this.deployer = deployer;
        this.smokeChecks = smokeChecks;
        this.notifications = notifications;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.config = properties.getIntegration();
        this.clock = clock;
    }

    /**
     * Open and run an attempt to completion.
     *
     * @return the attempt in its terminal state
     */
    public IntegrationAttempt integrate(String submissionId, DeploymentStrategy strategyHint) {
        return run(open(submissionId, strategyHint));
    }

    /**
     * Create a PENDING attempt and pick its effective strategy.
     *
     * @throws UnknownSubmissionException      if the submission does not exist
     * @throws InvalidSubmissionStateException if the submission is already terminal
     */
    public IntegrationAttempt open(String submissionId, DeploymentStrategy strategyHint) {
        Submission submission = store.findSubmission(submissionId)
                .orElseThrow(() -> new UnknownSubmissionException(submissionId));
        if (submission.status().isTerminal()) {
            throw new InvalidSubmissionStateException(
                    "Submission " + submissionId + " is " + submission.status() + "; no further integration");
        }

        DeploymentStrategy effective = chooseStrategy(strategyHint,
                store.latestReport(submissionId).orElse(null),
                store.latestAttempt(submissionId).orElse(null));

        IntegrationAttempt attempt = IntegrationAttempt.start(UUID.randomUUID().toString(), submissionId,
                submission.projectId(), strategyHint, effective, clock.instant());
        store.saveAttempt(attempt);
        controls.put(attempt.id(), new AttemptControl());

        if (strategyHint != null && strategyHint != effective) {
            log.info("Strategy hint {} for submission {} overridden to {}", strategyHint, submissionId, effective);
        }
        publish(EventTypes.INTEGRATION_STARTED, attempt, Map.of("strategy", effective.name()));
        return attempt;
    }

    /**
     * Run an opened attempt to a terminal state. Never throws for pipeline failures;
     * the outcome is on the returned attempt.
     */
    public IntegrationAttempt run(IntegrationAttempt opened) {
        MdcContext.setAttempt(opened.submissionId(), opened.projectId(), opened.id());
        AttemptControl control = controls.computeIfAbsent(opened.id(), k -> new AttemptControl());
        IntegrationAttempt attempt = advance(opened, AttemptState.VALIDATING);
        boolean locked = false;
        try {
            if (control.isCancelled()) {
                return finish(attempt, AttemptState.FAILED, "Cancelled before deployment", false);
            }

            try {
                locks.acquire(attempt.projectId(), attempt.id());
                locked = true;
            } catch (IntegrationConflictException e) {
                return finish(attempt, AttemptState.FAILED, "Integration conflict: " + e.getMessage(), false);
            }

            Optional<String> invalid = validate(attempt);
            if (invalid.isPresent()) {
                return finish(attempt, AttemptState.FAILED, "Validation failed: " + invalid.get(), false);
            }

            if (!control.enterDeploying()) {
                return finish(attempt, AttemptState.FAILED, "Cancelled before deployment", false);
            }

            return deployAndVerify(attempt);
        } finally {
            if (locked) {
                locks.release(attempt.projectId(), attempt.id());
            }
            controls.remove(attempt.id());
            MdcContext.clear();
        }
    }

    /**
     * Cancel an attempt that has not yet started deploying.
     *
     * @return {@code true} if the cancellation will be honoured
     */
    public boolean cancel(String attemptId) {
        AttemptControl control = controls.get(attemptId);
        boolean cancelled = control != null && control.tryCancel();
        log.info("Cancellation of attempt {} {}", attemptId, cancelled ? "accepted" : "refused");
        return cancelled;
    }

    DeploymentStrategy chooseStrategy(DeploymentStrategy hint, QualityReport report, IntegrationAttempt previous) {
        DeploymentStrategy strategy = hint != null ? hint : config.getDefaultStrategy();
        if (config.isForceBlueGreenOnRetry() && previous != null
                && (previous.state() == AttemptState.FAILED || previous.state() == AttemptState.ROLLED_BACK)) {
            return DeploymentStrategy.BLUE_GREEN;
        }
        if (strategy == DeploymentStrategy.HOT_RELOAD && report != null
                && report.hasIssueAtLeast(IssueSeverity.HIGH)) {
            return DeploymentStrategy.BLUE_GREEN;
        }
        return strategy;
    }

    private Optional<String> validate(IntegrationAttempt attempt) {
        Optional<Submission> submission = store.findSubmission(attempt.submissionId());
        if (submission.isEmpty()) {
            return Optional.of("submission " + attempt.submissionId() + " not found");
        }
        SubmissionStatus status = submission.get().status();
        if (!status.isIntegrable()) {
            return Optional.of("submission is " + status);
        }
        Optional<QualityReport> report = store.latestReport(attempt.submissionId());
        if (report.isEmpty() || !report.get().isAccepted()) {
            return Optional.of("latest quality report is not an ACCEPT");
        }
        boolean unresolvedRollback = store.attemptsFor(attempt.submissionId()).stream()
                .anyMatch(IntegrationAttempt::rollbackFailed);
        if (unresolvedRollback) {
            return Optional.of("a previous attempt failed to roll back; operator intervention required");
        }
        return Optional.empty();
    }

    private IntegrationAttempt deployAndVerify(IntegrationAttempt validated) {
        IntegrationAttempt attempt = validated;
        Submission submission;
        try {
            submission = store.transitionSubmission(attempt.submissionId(), SubmissionStatus.integrable(),
                    SubmissionStatus.INTEGRATING, "Integration attempt " + attempt.id());
        } catch (InvalidSubmissionStateException | UnknownSubmissionException e) {
            return finish(attempt, AttemptState.FAILED, "Validation failed: " + e.getMessage(), false);
        }
        attempt = advance(attempt, AttemptState.DEPLOYING);

        Snapshot snapshot;
        try {
            snapshot = rollbackManager.snapshot(attempt.projectId(), attempt.id());
        } catch (RuntimeException e) {
            log.warn("Snapshot of {} failed: {}", attempt.projectId(), e.getMessage());
            return finish(attempt.withError(e.getMessage()), AttemptState.FAILED,
                    "Snapshot failed before deployment", false);
        }
        attempt = attempt.withSnapshot(snapshot.id());
        store.saveAttempt(attempt);

        Ending ending;
        try {
            DeploymentOutcome outcome = deployer.execute(attempt.strategy(), submission, attempt.projectId(),
                    snapshot.id());
            if (!outcome.success()) {
                ending = new Ending(attempt.withError(outcome.detail()),
                        outcome.rollbackRequired() ? AttemptState.ROLLED_BACK : AttemptState.FAILED,
                        outcome.detail(), outcome.rollbackRequired());
            } else {
                attempt = advance(attempt, AttemptState.VERIFYING);
                var smoke = smokeChecks.run(submission, attempt.projectId(), null, "post-deploy");
                ending = smoke.passed()
                        ? new Ending(attempt, AttemptState.COMPLETED, outcome.detail(), false)
                        : new Ending(attempt.withError(smoke.detail()), AttemptState.ROLLED_BACK,
                                "Post-deploy verification failed: " + smoke.detail(), true);
            }
        } catch (RuntimeException e) {
            if (e instanceof DeploymentFailureException dfe && dfe.isTargetUnsettled()) {
                log.error("Attempt {} left target {} unsettled: {}", attempt.id(), attempt.projectId(), e.getMessage());
                return finish(attempt.withError(e.getMessage()).withRollbackFailed(), AttemptState.FAILED,
                        "Deployment failure: " + e.getMessage() + "; target not restored, operator intervention required",
                        true);
            }
            log.warn("Attempt {} failed during {}: {}", attempt.id(), attempt.state(), e.getMessage());
            AttemptState end = attempt.state() == AttemptState.VERIFYING ? AttemptState.ROLLED_BACK : AttemptState.FAILED;
            ending = new Ending(attempt.withError(e.getMessage()), end, "Deployment failure: " + e.getMessage(), true);
        }

        // the outcome is fixed here; nothing below may turn it into a restore
        return ending.restore()
                ? restoreAndFinish(ending.attempt(), ending.end(), ending.reason())
                : finish(ending.attempt(), ending.end(), ending.reason(), false);
    }

    private IntegrationAttempt restoreAndFinish(IntegrationAttempt attempt, AttemptState end, String reason) {
        publish(EventTypes.ROLLBACK_STARTED, attempt, Map.of("snapshotId", attempt.snapshotId()));
        try {
            rollbackManager.restore(attempt.snapshotId());
        } catch (RollbackFailureException e) {
            log.error("Rollback of attempt {} from snapshot {} failed: {}", attempt.id(), attempt.snapshotId(),
                    e.getMessage(), e);
            publish(EventTypes.ROLLBACK_FAILED, attempt, Map.of("snapshotId", attempt.snapshotId(),
                    "error", String.valueOf(e.getMessage())));
            return finish(attempt.withError(e.getMessage()).withRollbackFailed(), AttemptState.FAILED,
                    reason + "; rollback failed: " + e.getMessage(), true);
        }
        publish(EventTypes.ROLLBACK_COMPLETED, attempt, Map.of("snapshotId", attempt.snapshotId()));
        return finish(attempt, end, reason + " (target restored)", false);
    }

    /**
     * Record the terminal state. The attempt and submission are written first; the
     * metrics, events and notifications that follow cannot change the outcome.
     */
    private IntegrationAttempt finish(IntegrationAttempt attempt, AttemptState end, String reason, boolean alert) {
        boolean submissionTouched = attempt.state() == AttemptState.DEPLOYING
                || attempt.state() == AttemptState.VERIFYING;
        IntegrationAttempt done = attempt.withReason(reason).transitionTo(end, clock);
        try {
            store.saveAttempt(done);
            if (submissionTouched) {
                SubmissionStatus status = switch (end) {
                    case COMPLETED -> SubmissionStatus.INTEGRATED;
                    case ROLLED_BACK -> SubmissionStatus.ROLLED_BACK;
                    default -> SubmissionStatus.FAILED;
                };
                store.transitionSubmission(done.submissionId(), Set.of(SubmissionStatus.INTEGRATING), status, reason);
            }
        } catch (KeystoneException e) {
            log.error("Attempt {} ended {} but its record could not be written: {}", done.id(), end,
                    e.getMessage(), e);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("state", end.name());
        payload.put("strategy", done.strategy().name());
        payload.put("reason", reason);
        payload.put("rollbackFailed", done.rollbackFailed());
        publish(EventTypes.INTEGRATION_COMPLETED, done, payload);
        try {
            metrics.recordIntegrationResult(done.strategy().name(), end.name());
            notifications.publish(new PipelineNotification("integration", done.submissionId(), done.id(),
                    end.name(), reason, done.errors(), alert, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Reporting the end of attempt {} failed: {}", done.id(), e.getMessage(), e);
        }
        log.info("Attempt {} ended {}: {}", done.id(), end, reason);
        return done;
    }

    private IntegrationAttempt advance(IntegrationAttempt attempt, AttemptState next) {
        IntegrationAttempt moved = attempt.transitionTo(next, clock);
        store.saveAttempt(moved);
        publish(EventTypes.INTEGRATION_STATE, moved, Map.of("state", next.name()));
        log.info("Attempt {} -> {}", moved.id(), next);
        return moved;
    }

    private void publish(String type, IntegrationAttempt attempt, Map<String, Object> payload) {
        eventBus.publish(new PipelineEvent(type, attempt.submissionId(), attempt.id(), payload, clock.instant()));
    }

    private record Ending(IntegrationAttempt attempt, AttemptState end, String reason, boolean restore) {}
}
