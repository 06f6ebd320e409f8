package com.keystone.core.error;

/**
 * Root of the pipeline's unchecked exception hierarchy.
 */
public class KeystoneException extends RuntimeException {

    public KeystoneException(String message) {
        super(message);
    }

    public KeystoneException(String message, Throwable cause) {
        super(message, cause);
    }
}
