package com.keystone.core.integration;

/**
 * Cancellation latch for one running attempt. Cancellation wins only if it lands
 * before the attempt enters DEPLOYING.
 */
final class AttemptControl {

    private boolean cancelled;
    private boolean deploying;

    synchronized boolean tryCancel() {
        if (deploying) {
            return false;
        }
        cancelled = true;
        return true;
    }

    synchronized boolean enterDeploying() {
        if (cancelled) {
            return false;
        }
        deploying = true;
        return true;
    }

    synchronized boolean isCancelled() {
        return cancelled;
    }
}
