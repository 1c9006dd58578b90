package com.containermgmt.streamagent.session;

import com.containermgmt.streamagent.dto.Batch;
import com.containermgmt.streamagent.store.ApplyResult;

/**
 * Callbacks from a session to its owner.
 */
public interface SessionListener {

    /**
     * The gateway sent something the session understood: a frame that decoded
     * or a transport-level pong. Called on the transport thread.
     */
    void onFrameReceived(ConnectionSession session);

    /** The batch was committed and its ack written to the gateway. */
    void onBatchProcessed(ConnectionSession session, Batch batch, ApplyResult result);

    /**
     * The session reached CLOSED.
     *
     * @param cause the failure that ended the session, or null if it was closed on request
     */
    void onSessionClosed(ConnectionSession session, Throwable cause);
}
