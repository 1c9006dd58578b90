package com.containermgmt.streamagent.session;

import com.containermgmt.streamagent.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gateway transport over a Spring WebSocket client. Inbound text frames are
 * handed to the {@link FrameListener} on the container's reader thread;
 * binary frames are logged and dropped.
 */
@Component
@Slf4j
public class WebSocketGatewayTransport implements GatewayTransport {

    private final WebSocketClient webSocketClient;

    public WebSocketGatewayTransport(WebSocketClient webSocketClient) {
        this.webSocketClient = webSocketClient;
    }

    @Override
    public GatewayConnection connect(URI uri, FrameListener listener, Duration timeout) {
        CompletableFuture<WebSocketSession> handshake =
                webSocketClient.execute(new ListenerHandler(listener), new WebSocketHttpHeaders(), uri);
        try {
            WebSocketSession session = handshake.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("WebSocket session {} established with {}", session.getId(), uri);
            return new WebSocketGatewayConnection(session);
        } catch (TimeoutException e) {
            handshake.cancel(true);
            throw new ConnectionException("Handshake with " + uri + " timed out after " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConnectionException("Handshake with " + uri + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handshake.cancel(true);
            throw new ConnectionException("Interrupted during handshake with " + uri, e);
        }
    }

    private static final class ListenerHandler extends TextWebSocketHandler {

        private final FrameListener listener;

        private ListenerHandler(FrameListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            listener.onOpen(new WebSocketGatewayConnection(session));
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onFrame(message.getPayload());
        }

        @Override
        protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
            log.warn("Dropping binary frame ({} bytes) on WebSocket session {}",
                    message.getPayloadLength(), session.getId());
        }

        @Override
        protected void handlePongMessage(WebSocketSession session, PongMessage message) {
            ByteBuffer payload = message.getPayload().duplicate();
            byte[] bytes = new byte[payload.remaining()];
            payload.get(bytes);
            listener.onPong(new String(bytes, StandardCharsets.UTF_8));
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClosed(status.getCode() + (status.getReason() != null ? " " + status.getReason() : ""));
        }
    }

    private static final class WebSocketGatewayConnection implements GatewayConnection {

        private final WebSocketSession session;

        private WebSocketGatewayConnection(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(String frame) {
            try {
                session.sendMessage(new TextMessage(frame));
            } catch (IOException | IllegalStateException e) {
                throw new ConnectionException("Failed to write frame: " + e.getMessage(), e);
            }
        }

        @Override
        public void ping(String nonce) {
            try {
                session.sendMessage(new PingMessage(ByteBuffer.wrap(nonce.getBytes(StandardCharsets.UTF_8))));
            } catch (IOException | IllegalStateException e) {
                throw new ConnectionException("Failed to write ping: " + e.getMessage(), e);
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public void close() {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
