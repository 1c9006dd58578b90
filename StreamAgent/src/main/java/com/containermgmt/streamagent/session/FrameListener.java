package com.containermgmt.streamagent.session;

/**
 * Receives what the transport reads from the gateway.
 */
public interface FrameListener {

    /**
     * The handshake completed. Called before any frame of this connection is
     * delivered, so replies written from {@link #onFrame} have somewhere to go.
     */
    void onOpen(GatewayConnection connection);

    void onFrame(String frame);

    /** The gateway answered a transport-level ping. */
    void onPong(String nonce);

    /** The gateway or the network closed the connection. */
    void onClosed(String reason);

    void onError(Throwable error);
}
