package com.keystone.core.error;

/**
 * Restoring a snapshot failed; the target may be in an unknown state.
 */
public class RollbackFailureException extends KeystoneException {

    private final String snapshotId;

    public RollbackFailureException(String snapshotId, String message) {
        super(message);
        this.snapshotId = snapshotId;
    }

    public RollbackFailureException(String snapshotId, String message, Throwable cause) {
        super(message, cause);
        this.snapshotId = snapshotId;
    }

    public String getSnapshotId() {
        return snapshotId;
    }
}
