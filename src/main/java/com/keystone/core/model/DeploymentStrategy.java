package com.keystone.core.model;

/**
 * How an accepted submission is rolled onto its target.
 */
public enum DeploymentStrategy {
    /** Replace in place on the live target. */
    HOT_RELOAD,
    /** Stand up a parallel environment, verify it, then switch traffic. */
    BLUE_GREEN,
    /** Route a slice of traffic to the new version and watch health before promoting. */
    CANARY
}
