package com.keystone.core.model;

import java.io.Serializable;

/**
 * A single finding raised by a quality checker.
 *
 * @param file        relative path of the offending file, or {@code null} for project-wide findings
 * @param suggestion  remediation hint, may be {@code null}
 */
public record QualityIssue(
    IssueSeverity severity,
    String category,
    String file,
    String description,
    String suggestion
) implements Serializable {

    public static QualityIssue of(IssueSeverity severity, String category, String description) {
        return new QualityIssue(severity, category, null, description, null);
    }
}
