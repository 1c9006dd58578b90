package com.containermgmt.streamagent.exception;

/**
 * Session-level failure: the connection to the gateway is unusable and the
 * supervisor has to back off and reconnect.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
