package com.containermgmt.streamagent.exception;

/**
 * Failure applying a batch to the store. The batch transaction has been rolled back.
 */
public abstract class StoreException extends RuntimeException {

    protected StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /** True when reapplying the same batch may succeed. */
    public abstract boolean isRetryable();

}
