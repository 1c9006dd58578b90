package com.containermgmt.streamagent.session;

/**
 * One open connection to the gateway. Not safe for concurrent senders;
 * {@link ConnectionSession} serializes all writes.
 */
public interface GatewayConnection {

    /**
     * @throws com.containermgmt.streamagent.exception.ConnectionException if the frame
     *         could not be written
     */
    void send(String frame);

    /**
     * Sends a transport-level ping carrying {@code nonce}. The answer arrives
     * through {@link FrameListener#onPong}.
     *
     * @throws com.containermgmt.streamagent.exception.ConnectionException if the ping
     *         could not be written
     */
    void ping(String nonce);

    boolean isOpen();

    /** Closes the connection; never throws. */
    void close();
}
