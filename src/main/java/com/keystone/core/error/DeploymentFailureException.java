package com.keystone.core.error;

/**
 * A deployment step failed or exceeded its deadline.
 * <p>
 * {@link #isTargetUnsettled()} is set when a timed-out strategy could not be stopped,
 * so the target may still be changing and must not be restored automatically.
 */
public class DeploymentFailureException extends KeystoneException {

    private final boolean targetUnsettled;

    public DeploymentFailureException(String message) {
        this(message, null, false);
    }

    public DeploymentFailureException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public DeploymentFailureException(String message, Throwable cause, boolean targetUnsettled) {
        super(message, cause);
        this.targetUnsettled = targetUnsettled;
    }

    public boolean isTargetUnsettled() {
        return targetUnsettled;
    }
}
