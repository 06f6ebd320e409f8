package com.keystone.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * State machine for one integration attempt.
 */
public enum AttemptState {
    PENDING,
    VALIDATING,
    DEPLOYING,
    VERIFYING,
    COMPLETED,
    ROLLED_BACK,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK || this == FAILED;
    }

    public boolean canTransitionTo(AttemptState next) {
        return allowedNext().contains(next);
    }

    private Set<AttemptState> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(VALIDATING);
            case VALIDATING:
                return EnumSet.of(DEPLOYING, FAILED);
            case DEPLOYING:
                return EnumSet.of(VERIFYING, ROLLED_BACK, FAILED);
            case VERIFYING:
                return EnumSet.of(COMPLETED, ROLLED_BACK, FAILED);
            default:
                return EnumSet.noneOf(AttemptState.class);
        }
    }
}
