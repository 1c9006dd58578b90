package com.containermgmt.streamagent.exception;

/**
 * Keepalive ping went unanswered for longer than the pong timeout.
 */
public class LivenessException extends ConnectionException {

    public LivenessException(String message) {
        super(message);
    }

}
