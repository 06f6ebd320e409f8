package com.keystone.core.error;

/**
 * Another integration already holds the project lock.
 */
public class IntegrationConflictException extends KeystoneException {

    private final String projectId;
    private final String holder;

    public IntegrationConflictException(String projectId, String holder) {
        super("Project " + projectId + " is being integrated by attempt " + holder);
        this.projectId = projectId;
        this.holder = holder;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getHolder() {
        return holder;
    }
}
