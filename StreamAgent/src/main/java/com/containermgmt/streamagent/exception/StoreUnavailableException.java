package com.containermgmt.streamagent.exception;

/**
 * Transient store errors outlasted the retry budget for a batch. Escalated as a
 * session failure so that the supervisor's backoff takes over.
 */
public class StoreUnavailableException extends ConnectionException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

}
