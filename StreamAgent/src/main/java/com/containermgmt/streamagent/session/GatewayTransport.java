package com.containermgmt.streamagent.session;

import java.net.URI;
import java.time.Duration;

/**
 * Opens streaming connections to the gateway.
 */
public interface GatewayTransport {

    /**
     * Performs the handshake and returns the live connection. Frames and close
     * notifications are delivered to {@code listener} from the transport's threads.
     *
     * @throws com.containermgmt.streamagent.exception.ConnectionException if the
     *         handshake fails or does not complete within {@code timeout}
     */
    GatewayConnection connect(URI uri, FrameListener listener, Duration timeout);
}
