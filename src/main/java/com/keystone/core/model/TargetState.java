package com.keystone.core.model;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/**
 * Captured state of a deployment target: the deployed revision, its files and
 * the environment currently receiving traffic.
 */
public record TargetState(
    String targetId,
    long revision,
    String deployedSubmissionId,
    Map<String, String> files,
    String activeEnvironment
) implements Serializable {

    public TargetState {
        files = files == null ? Map.of() : java.util.Collections.unmodifiableMap(new TreeMap<>(files));
    }

    public static TargetState empty(String targetId) {
        return new TargetState(targetId, 0L, null, Map.of(), "blue");
    }
}
