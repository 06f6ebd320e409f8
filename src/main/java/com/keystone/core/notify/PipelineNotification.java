package com.keystone.core.notify;

import java.time.Instant;
import java.util.List;

/**
 * Terminal-state notice for a submission or integration attempt.
 *
 * @param kind         "verification" or "integration"
 * @param state        the terminal state reached (ACCEPTED, REJECTED, COMPLETED, ROLLED_BACK, FAILED)
 * @param reason       human-readable reason
 * @param details      issue or error list
 * @param alert        operator attention required (rollback failed)
 */
public record PipelineNotification(
    String kind,
    String submissionId,
    String attemptId,
    String state,
    String reason,
    List<String> details,
    boolean alert,
    Instant timestamp
) {

    public PipelineNotification {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
