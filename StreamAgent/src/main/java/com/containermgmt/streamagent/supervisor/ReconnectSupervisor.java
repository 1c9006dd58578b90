package com.containermgmt.streamagent.supervisor;

import com.containermgmt.streamagent.config.AgentProperties;
import com.containermgmt.streamagent.dto.Batch;
import com.containermgmt.streamagent.session.ConnectionSession;
import com.containermgmt.streamagent.session.ConnectionSessionFactory;
import com.containermgmt.streamagent.session.SessionListener;
import com.containermgmt.streamagent.store.ApplyResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one session to the gateway alive for the lifetime of the process.
 *
 * Runs on its own thread and reacts only to commands on its queue:
 * CONNECTING -> RUNNING while a session is open, BACKOFF after a failed open or
 * a lost session, SHUTTING_DOWN -> STOPPED on request. The backoff attempt
 * counter goes back to zero as soon as a session receives a frame it understands.
 */
@Component
@Slf4j
public class ReconnectSupervisor implements SessionListener {

    private final ConnectionSessionFactory sessionFactory;
    private final BackoffPolicy backoffPolicy;
    private final Duration shutdownGrace;

    private final BlockingQueue<SupervisorCommand> commands = new LinkedBlockingQueue<>();
    private final CountDownLatch stoppedLatch = new CountDownLatch(1);

    private volatile SupervisorState state = SupervisorState.IDLE;
    private volatile int attempt;
    private volatile ConnectionSession currentSession;
    private Thread thread;

    @Autowired
    public ReconnectSupervisor(ConnectionSessionFactory sessionFactory, AgentProperties agentProperties) {
        this(sessionFactory, BackoffPolicy.from(agentProperties.getBackoff()), agentProperties.getShutdownGrace());
    }

    public ReconnectSupervisor(ConnectionSessionFactory sessionFactory, BackoffPolicy backoffPolicy, Duration shutdownGrace) {
        this.sessionFactory = sessionFactory;
        this.backoffPolicy = backoffPolicy;
        this.shutdownGrace = shutdownGrace;
    }

    public synchronized void start() {
        if (state != SupervisorState.IDLE) {
            throw new IllegalStateException("Supervisor already started (state " + state + ")");
        }
        thread = new Thread(this::run, "agent-supervisor");
        thread.start();
    }

    /** Asks the supervisor to close the session and stop; returns immediately. */
    public synchronized void shutdown() {
        if (thread == null) {
            transition(SupervisorState.STOPPED);
            stoppedLatch.countDown();
            return;
        }
        commands.offer(SupervisorCommand.shutdown());
    }

    public boolean awaitStopped(Duration timeout) {
        try {
            return stoppedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public SupervisorState getState() {
        return state;
    }

    public int getAttempt() {
        return attempt;
    }

    public ConnectionSession getCurrentSession() {
        return currentSession;
    }

    // --- SessionListener (session threads) ---

    @Override
    public void onFrameReceived(ConnectionSession session) {
        if (attempt != 0) {
            commands.offer(SupervisorCommand.frameReceived(session));
        }
    }

    @Override
    public void onBatchProcessed(ConnectionSession session, Batch batch, ApplyResult result) {
        log.trace("Session {} processed batch {}", session.getId(), batch.batchId());
    }

    @Override
    public void onSessionClosed(ConnectionSession session, Throwable cause) {
        commands.offer(SupervisorCommand.sessionClosed(session, cause));
    }

    // --- Supervisor thread ---

    private void run() {
        log.info("Reconnect supervisor started: backoff {}..{}, jitter={}",
                backoffPolicy.getBase(), backoffPolicy.getMax(), backoffPolicy.isJitter());
        try {
            while (state != SupervisorState.SHUTTING_DOWN) {
                ConnectionSession session = connect();
                if (session != null) {
                    supervise(session);
                    if (state == SupervisorState.SHUTTING_DOWN) {
                        break;
                    }
                }
                backoff();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Reconnect supervisor interrupted");
        } catch (RuntimeException e) {
            log.error("Reconnect supervisor failed: {}", e.getMessage(), e);
        } finally {
            closeCurrentSession();
            transition(SupervisorState.STOPPED);
            stoppedLatch.countDown();
            log.info("Reconnect supervisor stopped");
        }
    }

    /**
     * @return the open session, or null if the attempt failed
     */
    private ConnectionSession connect() {
        transition(SupervisorState.CONNECTING);
        ConnectionSession session = sessionFactory.create(this);
        currentSession = session;
        try {
            session.open();
            transition(SupervisorState.RUNNING);
            return session;
        } catch (RuntimeException e) {
            log.warn("Connect attempt {} to {} failed: {}", attempt + 1, session.getUri(), e.getMessage());
            currentSession = null;
            return null;
        }
    }

    /**
     * Blocks until the session closes or shutdown is requested.
     */
    private void supervise(ConnectionSession session) throws InterruptedException {
        while (true) {
            SupervisorCommand command = commands.take();
            switch (command.type()) {
                case SHUTDOWN:
                    transition(SupervisorState.SHUTTING_DOWN);
                    return;
                case FRAME_RECEIVED:
                    if (command.session() == session && attempt != 0) {
                        log.info("Session {} is receiving, backoff attempt reset from {}", session.getId(), attempt);
                        attempt = 0;
                    }
                    break;
                case SESSION_CLOSED:
                    if (command.session() == session) {
                        currentSession = null;
                        log.warn("Session {} lost: {}", session.getId(),
                                command.cause() != null ? command.cause().getMessage() : "closed");
                        return;
                    }
                    log.debug("Ignoring close of stale session {}", command.session().getId());
                    break;
                default:
                    throw new IllegalStateException("Unhandled command " + command.type());
            }
        }
    }

    /**
     * Waits out the backoff delay, or less if SHUTDOWN arrives.
     */
    private void backoff() throws InterruptedException {
        transition(SupervisorState.BACKOFF);
        Duration delay = backoffPolicy.delayFor(attempt);
        log.info("Reconnecting in {} ms (attempt {})", delay.toMillis(), attempt + 1);

        long deadline = System.nanoTime() + delay.toNanos();
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            SupervisorCommand command = commands.poll(remaining, TimeUnit.NANOSECONDS);
            if (command == null) {
                break;
            }
            if (command.type() == SupervisorCommand.Type.SHUTDOWN) {
                transition(SupervisorState.SHUTTING_DOWN);
                return;
            }
            log.trace("Ignoring {} during backoff", command.type());
        }
        attempt++;
    }

    private void closeCurrentSession() {
        ConnectionSession session = currentSession;
        if (session != null) {
            session.close(shutdownGrace);
            currentSession = null;
        }
    }

    private void transition(SupervisorState next) {
        SupervisorState previous = state;
        if (previous != next) {
            state = next;
            log.info("Supervisor {} -> {}", previous, next);
        }
    }
}
