package com.keystone.core.error;

public class UnknownSubmissionException extends KeystoneException {

    public UnknownSubmissionException(String submissionId) {
        super("Unknown submission: " + submissionId);
    }
}
