package com.keystone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/submissions.
 *
 * @param projectId project the artifact targets
 * @param files     relative path to file content
 * @param metadata  producer-supplied metadata, e.g. {@code benchmark}; nullable
 */
public record SubmissionRequest(
    @JsonProperty("project_id") String projectId,
    Map<String, String> files,
    Map<String, Object> metadata
) {}
