package com.containermgmt.streamagent.supervisor;

import com.containermgmt.streamagent.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts the supervisor once the context is up and stops it gracefully on
 * context close (SIGTERM included).
 */
@Component
@Slf4j
public class AgentLifecycle implements SmartLifecycle {

    private static final Duration STOP_MARGIN = Duration.ofSeconds(5);

    private final ReconnectSupervisor supervisor;
    private final AgentProperties agentProperties;

    private volatile boolean running;

    public AgentLifecycle(ReconnectSupervisor supervisor, AgentProperties agentProperties) {
        this.supervisor = supervisor;
        this.agentProperties = agentProperties;
    }

    @Override
    public boolean isAutoStartup() {
        if (!agentProperties.isAutoStart()) {
            log.info("agent.auto-start is false, supervisor not started");
        }
        return agentProperties.isAutoStart();
    }

    @Override
    public void start() {
        log.info("Starting stream agent: {}", agentProperties.descriptor());
        supervisor.start();
        running = true;
    }

    @Override
    public void stop() {
        log.info("Stopping stream agent...");
        supervisor.shutdown();
        Duration timeout = agentProperties.getShutdownGrace().plus(STOP_MARGIN);
        if (!supervisor.awaitStopped(timeout)) {
            log.warn("Supervisor did not stop within {}", timeout);
        }
        running = false;
        log.info("Stream agent stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
