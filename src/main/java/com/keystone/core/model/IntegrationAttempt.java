package com.keystone.core.model;

import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One try at integrating a submission. Only the owning integrator mutates it,
 * always through {@link #transitionTo}.
 */
public record IntegrationAttempt(
    String id,
    String submissionId,
    String projectId,
    DeploymentStrategy requestedStrategy,
    DeploymentStrategy strategy,
    AttemptState state,
    String snapshotId,
    Instant startedAt,
    Instant endedAt,
    String reason,
    List<String> errors,
    boolean rollbackFailed
) implements Serializable {

    public IntegrationAttempt {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static IntegrationAttempt start(String id, String submissionId, String projectId,
                                           DeploymentStrategy requested, DeploymentStrategy effective,
                                           Instant now) {
        return new IntegrationAttempt(id, submissionId, projectId, requested, effective,
                AttemptState.PENDING, null, now, null, null, List.of(), false);
    }

    public IntegrationAttempt transitionTo(AttemptState next, Clock clock) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal attempt transition " + state + " -> " + next + " for " + id);
        }
        Instant ended = next.isTerminal() ? clock.instant() : null;
        return new IntegrationAttempt(id, submissionId, projectId, requestedStrategy, strategy, next,
                snapshotId, startedAt, ended, reason, errors, rollbackFailed);
    }

    public IntegrationAttempt withSnapshot(String snapshot) {
        return new IntegrationAttempt(id, submissionId, projectId, requestedStrategy, strategy, state,
                snapshot, startedAt, endedAt, reason, errors, rollbackFailed);
    }

    public IntegrationAttempt withReason(String why) {
        return new IntegrationAttempt(id, submissionId, projectId, requestedStrategy, strategy, state,
                snapshotId, startedAt, endedAt, why, errors, rollbackFailed);
    }

    public IntegrationAttempt withError(String error) {
        List<String> all = new ArrayList<>(errors);
        all.add(error);
        return new IntegrationAttempt(id, submissionId, projectId, requestedStrategy, strategy, state,
                snapshotId, startedAt, endedAt, reason, all, rollbackFailed);
    }

    public IntegrationAttempt withRollbackFailed() {
        return new IntegrationAttempt(id, submissionId, projectId, requestedStrategy, strategy, state,
                snapshotId, startedAt, endedAt, reason, errors, true);
    }
}
