package com.containermgmt.streamagent.session;

/**
 * Lifecycle of a single {@link ConnectionSession}: OPENING -> OPEN -> CLOSING -> CLOSED.
 */
public enum SessionState {
    OPENING,
    OPEN,
    CLOSING,
    CLOSED
}
