package com.keystone.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted as a submission moves through the pipeline, used for SSE
 * streaming and notifications.
 *
 * @param eventType    dotted event type (e.g. "verification.completed", "integration.state")
 * @param submissionId the submission this event belongs to, nullable for agent and circuit events
 * @param attemptId    the integration attempt, nullable outside integration
 * @param payload      event data
 * @param timestamp    when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String submissionId,
    String attemptId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
