package com.containermgmt.streamagent.exception;

/**
 * Connection loss, timeout, deadlock or a lost race on the sequence gate.
 */
public class TransientStoreException extends StoreException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

}
