package com.containermgmt.streamagent.supervisor;

import com.containermgmt.streamagent.session.ConnectionSession;

/**
 * Message on the supervisor's command queue. Sessions post FRAME_RECEIVED and
 * SESSION_CLOSED from their own threads; SHUTDOWN comes from the lifecycle.
 */
record SupervisorCommand(Type type, ConnectionSession session, Throwable cause) {

    enum Type {
        FRAME_RECEIVED,
        SESSION_CLOSED,
        SHUTDOWN
    }

    static SupervisorCommand frameReceived(ConnectionSession session) {
        return new SupervisorCommand(Type.FRAME_RECEIVED, session, null);
    }

    static SupervisorCommand sessionClosed(ConnectionSession session, Throwable cause) {
        return new SupervisorCommand(Type.SESSION_CLOSED, session, cause);
    }

    static SupervisorCommand shutdown() {
        return new SupervisorCommand(Type.SHUTDOWN, null, null);
    }
}
