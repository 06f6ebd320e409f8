package com.keystone.core.model;

/** Severity of a quality finding. */
public enum IssueSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
