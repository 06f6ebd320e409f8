package com.keystone.core.error;

public class SnapshotNotFoundException extends KeystoneException {

    public SnapshotNotFoundException(String snapshotId) {
        super("Snapshot not found: " + snapshotId);
    }
}
