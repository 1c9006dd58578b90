package com.containermgmt.streamagent.exception;

/**
 * Schema mismatch, constraint violation or a payload the store rejects.
 * Retrying the batch will not help.
 */
public class FatalStoreException extends StoreException {

    public FatalStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

}
