package com.keystone.core.error;

/**
 * The requested operation is not allowed in the submission's current status.
 */
public class InvalidSubmissionStateException extends KeystoneException {

    public InvalidSubmissionStateException(String message) {
        super(message);
    }
}
