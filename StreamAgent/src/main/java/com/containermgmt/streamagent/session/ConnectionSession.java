package com.containermgmt.streamagent.session;

import com.containermgmt.streamagent.codec.CodecException;
import com.containermgmt.streamagent.codec.EventCodec;
import com.containermgmt.streamagent.config.AgentProperties;
import com.containermgmt.streamagent.dto.Batch;
import com.containermgmt.streamagent.dto.GatewayFrame;
import com.containermgmt.streamagent.exception.ConnectionException;
import com.containermgmt.streamagent.exception.FatalStoreException;
import com.containermgmt.streamagent.exception.LivenessException;
import com.containermgmt.streamagent.exception.StoreUnavailableException;
import com.containermgmt.streamagent.exception.TransientStoreException;
import com.containermgmt.streamagent.store.ApplyResult;
import com.containermgmt.streamagent.store.IngestErrorRecorder;
import com.containermgmt.streamagent.store.StoreApplier;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One live connection to the gateway.
 *
 * The transport thread decodes frames and feeds batches into a bounded queue.
 * A single apply worker drains it, so batches are applied and acked strictly in
 * arrival order, one at a time. A full queue blocks the transport thread, which
 * is the only backpressure the gateway sees.
 *
 * Liveness is checked with a ping every interval, sent either as a WebSocket
 * control frame or as a JSON ping frame; a pong of either kind clears it.
 *
 * Any failure closes the session and is reported once through
 * {@link SessionListener#onSessionClosed}. Reconnecting is the supervisor's job.
 */
@Slf4j
public class ConnectionSession implements FrameListener {

    private static final long OFFER_WAIT_MS = 200;
    private static final long POLL_WAIT_MS = 200;

    private final long id;
    private final URI uri;
    private final GatewayTransport transport;
    private final EventCodec codec;
    private final StoreApplier storeApplier;
    private final IngestErrorRecorder errorRecorder;
    private final AgentProperties properties;
    private final SessionListener listener;

    private final AckProtocolHandler ackHandler;
    private final BlockingQueue<Batch> queue;
    private final Object lock = new Object();
    private final Object sendLock = new Object();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private final AtomicLong pingCounter = new AtomicLong();

    private volatile SessionState state = SessionState.OPENING;
    private volatile GatewayConnection connection;
    private volatile Throwable failure;
    private volatile Thread worker;
    private volatile ScheduledExecutorService keepalive;

    private volatile boolean receiverBlocked;
    private volatile boolean pingOutstanding;
    private volatile long pingSentAt;

    public ConnectionSession(long id,
                             URI uri,
                             GatewayTransport transport,
                             EventCodec codec,
                             StoreApplier storeApplier,
                             IngestErrorRecorder errorRecorder,
                             AgentProperties properties,
                             SessionListener listener) {
        this.id = id;
        this.uri = uri;
        this.transport = transport;
        this.codec = codec;
        this.storeApplier = storeApplier;
        this.errorRecorder = errorRecorder;
        this.properties = properties;
        this.listener = listener;
        this.ackHandler = new AckProtocolHandler(codec, this::send);
        this.queue = new ArrayBlockingQueue<>(properties.getQueueCapacity());
    }

    /**
     * Performs the handshake and starts the apply worker and keepalive.
     * A session whose open fails is CLOSED and is not reported to the listener.
     *
     * @throws ConnectionException if the handshake fails, times out or the
     *         session was closed while it was in progress
     */
    public void open() {
        log.info("Session {} connecting to {}", id, uri);

        GatewayConnection opened;
        try {
            opened = transport.connect(uri, this, properties.getConnectTimeout());
        } catch (RuntimeException e) {
            markClosedBeforeOpen();
            throw e;
        }

        synchronized (lock) {
            if (state != SessionState.OPENING) {
                opened.close();
                markClosedBeforeOpen();
                throw new ConnectionException("Session " + id + " was closed during handshake", failure);
            }
            connection = opened;
            state = SessionState.OPEN;
        }

        Thread applyThread = new Thread(this::runWorker, "agent-apply-" + id);
        applyThread.setDaemon(true);
        worker = applyThread;
        applyThread.start();

        startKeepalive();
        log.info("Session {} open: {}", id, uri);
    }

    /**
     * Stops accepting frames, lets the in-flight batch finish and ack within
     * {@code grace}, then closes the connection. Queued batches are left un-acked.
     */
    public void close(Duration grace) {
        synchronized (lock) {
            if (state == SessionState.CLOSED) {
                return;
            }
            if (state == SessionState.OPEN || state == SessionState.OPENING) {
                state = SessionState.CLOSING;
            }
        }
        log.info("Session {} closing (grace {})", id, grace);
        requestStop();
        stopKeepalive();

        if (worker != null && !awaitClosed(grace)) {
            log.warn("Session {} did not finish its in-flight batch within {}, closing connection", id, grace);
        }
        closeConnection();
    }

    public boolean awaitClosed(Duration timeout) {
        try {
            return closedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public long getId() {
        return id;
    }

    public URI getUri() {
        return uri;
    }

    public SessionState getState() {
        return state;
    }

    /** The failure that closed this session, or null. */
    public Throwable getFailure() {
        return failure;
    }

    public AckProtocolHandler getAckHandler() {
        return ackHandler;
    }

    // --- FrameListener (transport thread) ---

    @Override
    public void onOpen(GatewayConnection opened) {
        synchronized (lock) {
            if (state == SessionState.OPENING) {
                connection = opened;
            }
        }
    }

    @Override
    public void onFrame(String rawFrame) {
        if (!isAccepting()) {
            log.trace("Session {} ignoring frame in state {}", id, state);
            return;
        }

        GatewayFrame frame;
        try {
            frame = codec.decode(rawFrame);
        } catch (CodecException e) {
            log.warn("Session {} dropped malformed frame: {} [{}]", id, e.getReason(), e.abbreviatedFrame());
            return;
        }
        listener.onFrameReceived(this);

        if (frame instanceof GatewayFrame.BatchFrame) {
            enqueue(((GatewayFrame.BatchFrame) frame).batch());
        } else if (frame instanceof GatewayFrame.Ping) {
            log.trace("Session {} answering gateway ping", id);
            sendOrFail(codec.encodePong(((GatewayFrame.Ping) frame).nonce()));
        } else if (frame instanceof GatewayFrame.Pong) {
            pingOutstanding = false;
            log.trace("Session {} received pong {}", id, ((GatewayFrame.Pong) frame).nonce());
        } else if (frame instanceof GatewayFrame.GatewayError) {
            log.warn("Session {} gateway reported error: {}", id, ((GatewayFrame.GatewayError) frame).message());
        }
    }

    @Override
    public void onPong(String nonce) {
        if (!isAccepting()) {
            return;
        }
        pingOutstanding = false;
        log.trace("Session {} received transport pong {}", id, nonce);
        listener.onFrameReceived(this);
    }

    @Override
    public void onClosed(String reason) {
        if (isAccepting()) {
            fail(new ConnectionException("Gateway closed the connection: " + reason));
        } else {
            log.debug("Session {} transport closed: {}", id, reason);
        }
    }

    @Override
    public void onError(Throwable error) {
        fail(new ConnectionException("Transport error: " + error.getMessage(), error));
    }

    private void enqueue(Batch batch) {
        log.debug("Session {} received batch {} ({} events)", id, batch.batchId(), batch.size());
        ackHandler.register(batch);

        boolean queued = false;
        try {
            while (!queued && isAccepting()) {
                queued = queue.offer(batch, OFFER_WAIT_MS, TimeUnit.MILLISECONDS);
                if (!queued && !receiverBlocked) {
                    receiverBlocked = true;
                    log.debug("Session {} apply queue full, holding the receive loop", id);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (receiverBlocked) {
                receiverBlocked = false;
                if (pingOutstanding) {
                    pingSentAt = System.nanoTime();
                }
            }
        }

        if (!queued) {
            ackHandler.onBatchAbandoned(batch);
        }
    }

    // --- Apply worker ---

    private void runWorker() {
        log.debug("Session {} apply worker started", id);
        try {
            while (!isStopRequested()) {
                Batch batch = queue.poll(POLL_WAIT_MS, TimeUnit.MILLISECONDS);
                if (batch != null) {
                    process(batch);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(new ConnectionException("Apply worker interrupted"));
        } catch (ConnectionException e) {
            fail(e);
        } catch (RuntimeException e) {
            log.error("Session {} apply worker failed unexpectedly: {}", id, e.getMessage(), e);
            fail(e);
        } finally {
            finish();
        }
    }

    private void process(Batch batch) {
        ApplyResult result;
        try {
            result = applyWithRetry(batch);
        } catch (FatalStoreException e) {
            log.error("Session {} dropping batch {} ({} events) without ack: {}",
                    id, batch.batchId(), batch.size(), e.getMessage(), e);
            errorRecorder.record(batch, e);
            ackHandler.onBatchAbandoned(batch);
            return;
        } catch (RuntimeException e) {
            ackHandler.onBatchAbandoned(batch);
            throw e;
        }

        if (result == null) {
            ackHandler.onBatchAbandoned(batch);
            return;
        }

        ackHandler.onBatchApplied(batch);
        log.info("Session {} batch {} committed and acked: applied={}, skipped={}",
                id, batch.batchId(), result.applied(), result.skipped());
        listener.onBatchProcessed(this, batch, result);
    }

    /**
     * @return the result, or null if the session stopped while waiting to retry
     * @throws StoreUnavailableException once transient failures use up the attempts
     */
    private ApplyResult applyWithRetry(Batch batch) {
        int maxAttempts = properties.getApply().getMaxAttempts();
        int attempts = 0;
        TransientStoreException lastException = null;

        while (attempts < maxAttempts) {
            try {
                return storeApplier.apply(batch);
            } catch (TransientStoreException e) {
                attempts++;
                lastException = e;
                log.warn("Apply attempt {} failed for batch {}: {}", attempts, batch.batchId(), e.getMessage());

                if (attempts < maxAttempts && !pause(properties.getApply().getRetryDelay())) {
                    log.debug("Session {} stopping, batch {} left for redelivery", id, batch.batchId());
                    return null;
                }
            }
        }

        log.error("Max attempts ({}) reached for batch {}", maxAttempts, batch.batchId());
        throw new StoreUnavailableException(
                "Store unavailable: batch " + batch.batchId() + " failed after " + maxAttempts + " attempts",
                lastException);
    }

    /**
     * @return false if the session was asked to stop during the pause
     */
    private boolean pause(Duration delay) {
        try {
            return !stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void finish() {
        List<Batch> discarded = new ArrayList<>();
        queue.drainTo(discarded);
        discarded.forEach(ackHandler::onBatchAbandoned);
        if (!discarded.isEmpty()) {
            log.info("Session {} discarded {} queued batch(es) for redelivery", id, discarded.size());
        }

        stopKeepalive();
        closeConnection();

        Throwable cause;
        synchronized (lock) {
            state = SessionState.CLOSED;
            cause = failure;
        }
        closedLatch.countDown();

        if (cause == null) {
            log.info("Session {} closed (acked={}, unacked={})",
                    id, ackHandler.ackedCount(), ackHandler.abandonedCount());
        } else {
            log.warn("Session {} closed after failure: {}", id, cause.getMessage());
        }
        listener.onSessionClosed(this, cause);
    }

    // --- Keepalive ---

    private void startKeepalive() {
        long intervalMs = properties.getKeepalive().getPingInterval().toMillis();
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "agent-keepalive-" + id);
            t.setDaemon(true);
            return t;
        });
        keepalive = executor;
        executor.scheduleAtFixedRate(this::keepaliveTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void keepaliveTick() {
        if (state != SessionState.OPEN) {
            return;
        }
        try {
            if (pingOutstanding) {
                checkPong();
                return;
            }
            String nonce = String.valueOf(pingCounter.incrementAndGet());
            pingSentAt = System.nanoTime();
            pingOutstanding = true;
            if (properties.getKeepalive().isTransportPing()) {
                ping(nonce);
            } else {
                send(codec.encodePing(nonce));
            }
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    private void checkPong() {
        if (receiverBlocked) {
            // pong may be sitting unread behind our own backpressure
            log.debug("Session {} receive loop blocked, deferring liveness check", id);
            return;
        }
        Duration timeout = properties.getKeepalive().getPongTimeout();
        long waitedNanos = System.nanoTime() - pingSentAt;
        if (waitedNanos > timeout.toNanos()) {
            throw new LivenessException("No pong from gateway within " + timeout);
        }
    }

    private void stopKeepalive() {
        ScheduledExecutorService executor = keepalive;
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    // --- Connection ---

    private void send(String frame) {
        GatewayConnection current = connection;
        if (current == null || !current.isOpen()) {
            throw new ConnectionException("Session " + id + " has no open connection");
        }
        synchronized (sendLock) {
            current.send(frame);
        }
    }

    private void ping(String nonce) {
        GatewayConnection current = connection;
        if (current == null || !current.isOpen()) {
            throw new ConnectionException("Session " + id + " has no open connection");
        }
        synchronized (sendLock) {
            current.ping(nonce);
        }
    }

    private void sendOrFail(String frame) {
        try {
            send(frame);
        } catch (ConnectionException e) {
            fail(e);
        }
    }

    private void fail(Throwable cause) {
        synchronized (lock) {
            if (state != SessionState.OPEN && state != SessionState.OPENING) {
                log.debug("Session {} already {}, ignoring: {}", id, state, cause.getMessage());
                return;
            }
            failure = cause;
            state = SessionState.CLOSING;
        }
        log.warn("Session {} failed: {}", id, cause.getMessage());
        requestStop();
        stopKeepalive();
        closeConnection();
    }

    private void requestStop() {
        stopSignal.countDown();
    }

    private boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    private boolean isAccepting() {
        SessionState current = state;
        return (current == SessionState.OPEN || current == SessionState.OPENING) && !isStopRequested();
    }

    private void closeConnection() {
        GatewayConnection current = connection;
        if (current != null) {
            current.close();
        }
    }

    private void markClosedBeforeOpen() {
        synchronized (lock) {
            state = SessionState.CLOSED;
        }
        stopKeepalive();
        closedLatch.countDown();
    }
}
