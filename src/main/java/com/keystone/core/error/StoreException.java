package com.keystone.core.error;

/**
 * The pipeline store could not read or write a record.
 */
public class StoreException extends KeystoneException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
