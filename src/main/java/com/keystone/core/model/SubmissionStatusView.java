package com.keystone.core.model;

/**
 * Combined view returned by status queries: the submission with its latest
 * report and attempt, either of which may be {@code null}.
 */
public record SubmissionStatusView(
    Submission submission,
    QualityReport latestReport,
    IntegrationAttempt latestAttempt
) {}
