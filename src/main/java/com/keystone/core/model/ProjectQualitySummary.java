package com.keystone.core.model;

import java.util.Map;

/**
 * Per-project roll-up of verification and integration history.
 * {@code approvalRate} is accepted reports over all reports, 0 when there are none.
 */
public record ProjectQualitySummary(
    String projectId,
    int submissions,
    int reports,
    int accepted,
    int rejected,
    double approvalRate,
    double averageScore,
    Map<IssueSeverity, Long> issuesBySeverity,
    int integrated,
    int rolledBack,
    int failed
) {}
