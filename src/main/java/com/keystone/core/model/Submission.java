package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Work item received from an agent, targeting a single project.
 */
public record Submission(
    String id,
    String projectId,
    Artifact artifact,
    Map<String, Object> metadata,
    SubmissionStatus status,
    String reason,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public Submission {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Submission withStatus(SubmissionStatus next, String why, Instant now) {
        return new Submission(id, projectId, artifact, metadata, next, why, createdAt, now);
    }
}
