package com.containermgmt.streamagent.supervisor;

public enum SupervisorState {
    IDLE,
    CONNECTING,
    RUNNING,
    BACKOFF,
    SHUTTING_DOWN,
    STOPPED
}
