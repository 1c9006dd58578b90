package com.containermgmt.streamagent.dto;

/**
 * Decoded inbound frame from the gateway.
 */
public interface GatewayFrame {

    /** A batch of events awaiting apply and ack. */
    record BatchFrame(Batch batch) implements GatewayFrame {
    }

    /** Gateway liveness check, answered with a pong. */
    record Ping(String nonce) implements GatewayFrame {
    }

    /** Answer to a ping sent by this agent. */
    record Pong(String nonce) implements GatewayFrame {
    }

    /** Error reported by the gateway for this subscription. */
    record GatewayError(String message) implements GatewayFrame {
    }
}
