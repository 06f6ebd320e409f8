package com.keystone.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a submission from receipt to integration.
 */
public enum SubmissionStatus {
    RECEIVED,
    VERIFYING,
    ACCEPTED,
    REJECTED,
    INTEGRATING,
    INTEGRATED,
    ROLLED_BACK,
    FAILED;

    /** REJECTED and INTEGRATED accept no further transitions. */
    public boolean isTerminal() {
        return this == REJECTED || this == INTEGRATED;
    }

    /** States from which an integration attempt may be started. */
    public boolean isIntegrable() {
        return this == ACCEPTED || this == ROLLED_BACK || this == FAILED;
    }

    /** States from which verification may start; excludes INTEGRATING and the terminal states. */
    public static Set<SubmissionStatus> verifiable() {
        return EnumSet.of(RECEIVED, VERIFYING, ACCEPTED, ROLLED_BACK, FAILED);
    }

    public static Set<SubmissionStatus> integrable() {
        return EnumSet.of(ACCEPTED, ROLLED_BACK, FAILED);
    }

    public static Set<SubmissionStatus> nonTerminal() {
        return EnumSet.complementOf(EnumSet.of(REJECTED, INTEGRATED));
    }
}
