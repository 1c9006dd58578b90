package com.containermgmt.streamagent.session;

import com.containermgmt.streamagent.codec.EventCodec;
import com.containermgmt.streamagent.config.AgentProperties;
import com.containermgmt.streamagent.config.JacksonConfig;
import com.containermgmt.streamagent.dto.Batch;
import com.containermgmt.streamagent.exception.ConnectionException;
import com.containermgmt.streamagent.exception.FatalStoreException;
import com.containermgmt.streamagent.exception.LivenessException;
import com.containermgmt.streamagent.exception.StoreUnavailableException;
import com.containermgmt.streamagent.exception.TransientStoreException;
import com.containermgmt.streamagent.store.ApplyResult;
import com.containermgmt.streamagent.store.IngestErrorRecorder;
import com.containermgmt.streamagent.store.StoreApplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConnectionSessionTest {

    private static final URI STREAM_URI = URI.create("ws://gateway:8000/stream?subject=snapfs.files&durable=mysql&batch=100");

    private final EventCodec codec = new EventCodec(JacksonConfig.gatewayObjectMapper());
    private final FakeGatewayTransport transport = new FakeGatewayTransport();
    private final RecordingListener listener = new RecordingListener();

    private AgentProperties properties;
    private StoreApplier storeApplier;
    private IngestErrorRecorder errorRecorder;
    private ConnectionSession session;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        properties.getKeepalive().setPingInterval(Duration.ofHours(1));
        properties.getApply().setRetryDelay(Duration.ofMillis(10));
        storeApplier = mock(StoreApplier.class);
        errorRecorder = mock(IngestErrorRecorder.class);
    }

    @AfterEach
    void tearDown() {
        if (session != null) {
            session.close(Duration.ofSeconds(1));
        }
    }

    @Test
    void acksOnlyAfterApplyReturns() throws Exception {
        CountDownLatch applyStarted = new CountDownLatch(1);
        CountDownLatch releaseApply = new CountDownLatch(1);
        when(storeApplier.apply(any())).thenAnswer(invocation -> {
            applyStarted.countDown();
            releaseApply.await(5, TimeUnit.SECONDS);
            return new ApplyResult(1, 0);
        });
        FakeGatewayTransport.FakeConnection connection = open();

        connection.receive(batchFrame("b1", "t1", "f42", 5));

        assertThat(applyStarted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(connection.sent.poll(200, TimeUnit.MILLISECONDS)).isNull();

        releaseApply.countDown();

        assertThat(connection.awaitSent()).isEqualTo(codec.encodeAck("t1"));
        Batch processed = listener.awaitProcessed();
        assertThat(processed.batchId()).isEqualTo("b1");
        assertThat(session.getAckHandler().pendingCount()).isZero();
    }

    @Test
    void appliesBatchesInArrivalOrder() throws Exception {
        BlockingQueue<String> applied = new LinkedBlockingQueue<>();
        when(storeApplier.apply(any())).thenAnswer(invocation -> {
            applied.add(invocation.<Batch>getArgument(0).batchId());
            return new ApplyResult(1, 0);
        });
        FakeGatewayTransport.FakeConnection connection = open();

        connection.receive(batchFrame("b1", "t1", "f1", 1));
        connection.receive(batchFrame("b2", "t2", "f1", 2));
        connection.receive(batchFrame("b3", "t3", "f2", 1));

        assertThat(List.of(connection.awaitSent(), connection.awaitSent(), connection.awaitSent()))
                .containsExactly(codec.encodeAck("t1"), codec.encodeAck("t2"), codec.encodeAck("t3"));
        assertThat(applied).containsExactly("b1", "b2", "b3");
    }

    @Test
    void fatalStoreErrorDropsBatchWithoutAckAndKeepsSessionOpen() throws Exception {
        FatalStoreException fatal = new FatalStoreException("Malformed payload for entity f42", null);
        when(storeApplier.apply(argThat(b -> b != null && b.batchId().equals("b1")))).thenThrow(fatal);
        when(storeApplier.apply(argThat(b -> b != null && b.batchId().equals("b2")))).thenReturn(new ApplyResult(1, 0));
        FakeGatewayTransport.FakeConnection connection = open();

        connection.receive(batchFrame("b1", "t1", "f42", 5));
        connection.receive(batchFrame("b2", "t2", "f43", 1));

        assertThat(connection.awaitSent()).isEqualTo(codec.encodeAck("t2"));
        verify(errorRecorder).record(argThat(b -> b.batchId().equals("b1")), any(FatalStoreException.class));
        assertThat(connection.sent).isEmpty();
        assertThat(session.getState()).isEqualTo(SessionState.OPEN);
        assertThat(session.getAckHandler().abandonedCount()).isEqualTo(1);
    }

    @Test
    void malformedFrameIsDroppedAndSessionContinues() throws Exception {
        when(storeApplier.apply(any())).thenReturn(new ApplyResult(1, 0));
        FakeGatewayTransport.FakeConnection connection = open();

        connection.receive("{\"type\":\"events\",\"batch_id\":\"b0\"");
        connection.receive("{\"type\":\"events\",\"batch_id\":\"bx\",\"ack_token\":\"tx\",\"events\":[{\"kind\":\"file.upsert\"}]}");
        connection.receive(batchFrame("b1", "t1", "f1", 1));

        assertThat(connection.awaitSent()).isEqualTo(codec.encodeAck("t1"));
        verify(storeApplier, times(1)).apply(any());
        assertThat(session.getState()).isEqualTo(SessionState.OPEN);
    }

    @Test
    void answersPingWithPong() throws Exception {
        FakeGatewayTransport.FakeConnection connection = open();

        connection.receive("{\"type\":\"ping\",\"nonce\":\"abc\"}");

        assertThat(connection.awaitSent()).isEqualTo(codec.encodePong("abc"));
    }

    @Test
    void retriesTransientFailuresOnTheSameBatch() throws Exception {
        TransientStoreException deadlock = new TransientStoreException("Deadlock found", null);
        when(storeApplier.apply(any()))
                .thenThrow(deadlock)
                .thenThrow(deadlock)
                .thenReturn(new ApplyResult(1, 0));
        FakeGatewayTransport.FakeConnection connection = open();

        connection.receive(batchFrame("b1", "t1", "f1", 1));

        assertThat(connection.awaitSent()).isEqualTo(codec.encodeAck("t1"));
        verify(storeApplier, times(3)).apply(any());
    }

    @Test
    void exhaustedTransientRetriesFailTheSessionWithoutAck() throws Exception {
        when(storeApplier.apply(any())).thenThrow(new TransientStoreException("Connection refused", null));
        FakeGatewayTransport.FakeConnection connection = open();

        connection.receive(batchFrame("b1", "t1", "f1", 1));

        Throwable cause = listener.awaitClosed();
        assertThat(cause).isInstanceOf(StoreUnavailableException.class).hasMessageContaining("b1");
        assertThat(cause.getCause()).isInstanceOf(TransientStoreException.class);
        verify(storeApplier, times(3)).apply(any());
        assertThat(connection.sent).isEmpty();
        assertThat(connection.isOpen()).isFalse();
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        verify(errorRecorder, never()).record(any(), any());
    }

    @Test
    void pingDuringHandshakeIsAnswered() throws Exception {
        transport.sendDuringHandshake("{\"type\":\"ping\",\"nonce\":\"early\"}");

        FakeGatewayTransport.FakeConnection connection = open();

        assertThat(connection.awaitSent()).isEqualTo(codec.encodePong("early"));
        assertThat(session.getState()).isEqualTo(SessionState.OPEN);
        assertThat(listener.closed.getCount()).isEqualTo(1);
    }

    @Test
    void reportsEveryDecodedFrameButNotMalformedOnes() throws Exception {
        FakeGatewayTransport.FakeConnection connection = open();

        connection.receive("not json");
        connection.receive("{\"type\":\"ping\",\"nonce\":\"1\"}");
        connection.receive("{\"type\":\"pong\"}");
        connection.receive("{\"type\":\"error\",\"message\":\"consumer lagging\"}");

        assertThat(listener.framesReceived.get()).isEqualTo(3);
    }

    @Test
    void unansweredTransportPingFailsLiveness() throws Exception {
        properties.getKeepalive().setPingInterval(Duration.ofMillis(50));
        properties.getKeepalive().setPongTimeout(Duration.ofMillis(150));
        FakeGatewayTransport.FakeConnection connection = open();

        assertThat(connection.awaitPing()).isEqualTo("1");

        assertThat(listener.awaitClosed()).isInstanceOf(LivenessException.class);
        assertThat(connection.sent).isEmpty();
    }

    @Test
    void transportPongsKeepTheSessionAlive() throws Exception {
        properties.getKeepalive().setPingInterval(Duration.ofMillis(50));
        properties.getKeepalive().setPongTimeout(Duration.ofMillis(300));
        FakeGatewayTransport.FakeConnection connection = open();

        for (int i = 0; i < 10; i++) {
            connection.pong(connection.awaitPing());
        }

        assertThat(session.getState()).isEqualTo(SessionState.OPEN);
        assertThat(listener.closed.getCount()).isEqualTo(1);
        assertThat(listener.framesReceived.get()).isGreaterThanOrEqualTo(10);
    }

    @Test
    void unansweredPingFailsLiveness() throws Exception {
        properties.getKeepalive().setTransportPing(false);
        properties.getKeepalive().setPingInterval(Duration.ofMillis(50));
        properties.getKeepalive().setPongTimeout(Duration.ofMillis(150));
        FakeGatewayTransport.FakeConnection connection = open();

        assertThat(connection.awaitSent()).contains("\"type\":\"ping\"");

        Throwable cause = listener.awaitClosed();
        assertThat(cause).isInstanceOf(LivenessException.class);
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
    }

    @Test
    void pongsKeepTheSessionAlive() throws Exception {
        properties.getKeepalive().setTransportPing(false);
        properties.getKeepalive().setPingInterval(Duration.ofMillis(50));
        properties.getKeepalive().setPongTimeout(Duration.ofMillis(300));
        FakeGatewayTransport.FakeConnection connection = open();

        for (int i = 0; i < 10; i++) {
            String ping = connection.awaitSent();
            assertThat(ping).contains("\"type\":\"ping\"");
            connection.receive("{\"type\":\"pong\"}");
        }

        assertThat(session.getState()).isEqualTo(SessionState.OPEN);
        assertThat(listener.closed.getCount()).isEqualTo(1);
    }

    @Test
    void gatewayCloseFailsSessionAndReportsCause() throws Exception {
        FakeGatewayTransport.FakeConnection connection = open();

        connection.drop("1006 abnormal closure");

        Throwable cause = listener.awaitClosed();
        assertThat(cause).isInstanceOf(ConnectionException.class).hasMessageContaining("1006");
        assertThat(session.getFailure()).isSameAs(cause);
    }

    @Test
    void gracefulCloseLetsInFlightBatchFinishAndAck() throws Exception {
        CountDownLatch applyStarted = new CountDownLatch(1);
        CountDownLatch releaseApply = new CountDownLatch(1);
        when(storeApplier.apply(any())).thenAnswer(invocation -> {
            applyStarted.countDown();
            releaseApply.await(5, TimeUnit.SECONDS);
            return new ApplyResult(1, 0);
        });
        FakeGatewayTransport.FakeConnection connection = open();
        connection.receive(batchFrame("b1", "t1", "f1", 1));
        assertThat(applyStarted.await(5, TimeUnit.SECONDS)).isTrue();

        Thread closer = new Thread(() -> session.close(Duration.ofSeconds(5)));
        closer.start();
        awaitState(SessionState.CLOSING);
        connection.receive(batchFrame("b2", "t2", "f2", 1));
        releaseApply.countDown();
        closer.join(5000);

        assertThat(connection.sent).containsExactly(codec.encodeAck("t1"));
        assertThat(listener.awaitClosed()).isNull();
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(connection.isOpen()).isFalse();
        verify(storeApplier, timeout(500).times(1)).apply(any());
    }

    @Test
    void failedHandshakeClosesSessionWithoutCallback() {
        transport.failNextConnects(1);
        session = newSession();

        assertThatThrownBy(() -> session.open()).isInstanceOf(ConnectionException.class);

        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(listener.closed.getCount()).isEqualTo(1);
    }

    private FakeGatewayTransport.FakeConnection open() throws InterruptedException {
        session = newSession();
        session.open();
        assertThat(session.getState()).isEqualTo(SessionState.OPEN);
        return transport.awaitConnection();
    }

    private void awaitState(SessionState expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (session.getState() != expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("session still " + session.getState() + ", expected " + expected);
            }
            Thread.sleep(5);
        }
    }

    private ConnectionSession newSession() {
        return new ConnectionSession(1, STREAM_URI, transport, codec, storeApplier, errorRecorder, properties, listener);
    }

    private static String batchFrame(String batchId, String ackToken, String entityId, long sequence) {
        return "{\"type\":\"events\",\"batch_id\":\"" + batchId + "\",\"ack_token\":\"" + ackToken + "\",\"events\":["
                + "{\"kind\":\"file.upsert\",\"entity_id\":\"" + entityId + "\",\"sequence\":" + sequence
                + ",\"payload\":{\"path\":\"/" + entityId + "\"}}]}";
    }

    static class RecordingListener implements SessionListener {

        final BlockingQueue<Batch> processed = new LinkedBlockingQueue<>();
        final CountDownLatch closed = new CountDownLatch(1);
        final AtomicInteger framesReceived = new AtomicInteger();
        volatile Throwable closeCause;

        @Override
        public void onFrameReceived(ConnectionSession session) {
            framesReceived.incrementAndGet();
        }

        @Override
        public void onBatchProcessed(ConnectionSession session, Batch batch, ApplyResult result) {
            processed.add(batch);
        }

        @Override
        public void onSessionClosed(ConnectionSession session, Throwable cause) {
            closeCause = cause;
            closed.countDown();
        }

        Batch awaitProcessed() throws InterruptedException {
            Batch batch = processed.poll(5, TimeUnit.SECONDS);
            if (batch == null) {
                throw new AssertionError("no batch processed within 5s");
            }
            return batch;
        }

        Throwable awaitClosed() throws InterruptedException {
            if (!closed.await(5, TimeUnit.SECONDS)) {
                throw new AssertionError("session not closed within 5s");
            }
            return closeCause;
        }
    }
}
