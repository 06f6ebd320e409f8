package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Point-in-time copy of a target, taken before any mutating deployment.
 *
 * @param version  monotonically increasing per target
 * @param checksum SHA-256 hex digest of the canonical JSON form of {@code state}
 */
public record Snapshot(
    String id,
    String targetId,
    String attemptId,
    long version,
    TargetState state,
    String checksum,
    Instant createdAt
) implements Serializable {}
