package com.containermgmt.streamagent.config;

import com.containermgmt.streamagent.dto.SubscriptionDescriptor;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Typed binding for all agent.* configuration.
 * Centralises every tunable knob of the gateway consumer so that the
 * supervisor, the session and the applier read a single object.
 */
@Configuration
@ConfigurationProperties(prefix = "agent")
@Data
@Slf4j
public class AgentProperties {

    /** Gateway WebSocket base URL (ws://host:port). */
    private String gatewayUrl = "ws://localhost:8000";

    /** Logical event stream to consume. */
    private String subject = "snapfs.files";

    /** Durable consumer name kept by the gateway across reconnects. */
    private String durable = "mysql";

    /** Maximum events per batch requested from the gateway. */
    private int batchSize = 100;

    /** Start the supervisor together with the application context. */
    private boolean autoStart = true;

    /** Upper bound for the WebSocket handshake. */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Largest text frame accepted from the gateway. */
    private DataSize maxFrameBytes = DataSize.ofMegabytes(4);

    /** Batches received but not yet applied. */
    private int queueCapacity = 8;

    /** How long shutdown waits for an in-flight batch. */
    private Duration shutdownGrace = Duration.ofSeconds(30);

    private Backoff backoff = new Backoff();

    private Keepalive keepalive = new Keepalive();

    private Apply apply = new Apply();

    @Data
    public static class Backoff {
        private Duration base = Duration.ofSeconds(1);
        private Duration max = Duration.ofSeconds(30);
        private boolean jitter = true;
    }

    @Data
    public static class Keepalive {
        private Duration pingInterval = Duration.ofSeconds(15);
        private Duration pongTimeout = Duration.ofSeconds(45);
        /** Ping with WebSocket control frames, which any gateway answers; false sends JSON ping frames. */
        private boolean transportPing = true;
    }

    @Data
    public static class Apply {
        /** Attempts on the same batch before the session is failed. */
        private int maxAttempts = 3;
        private Duration retryDelay = Duration.ofSeconds(2);
    }

    public SubscriptionDescriptor descriptor() {
        return new SubscriptionDescriptor(subject, durable, batchSize);
    }

    @PostConstruct
    public void validate() {
        require(gatewayUrl != null && !gatewayUrl.isBlank(), "agent.gateway-url must be set");
        require(subject != null && !subject.isBlank(), "agent.subject must be set");
        require(durable != null && !durable.isBlank(), "agent.durable must be set");
        require(batchSize > 0, "agent.batch-size must be > 0, got " + batchSize);
        require(queueCapacity > 0, "agent.queue-capacity must be > 0, got " + queueCapacity);
        require(isPositive(connectTimeout), "agent.connect-timeout must be positive");
        require(isPositive(backoff.getBase()), "agent.backoff.base must be positive");
        require(backoff.getMax() != null && backoff.getMax().compareTo(backoff.getBase()) >= 0,
                "agent.backoff.max must not be below agent.backoff.base");
        require(isPositive(keepalive.getPingInterval()), "agent.keepalive.ping-interval must be positive");
        require(isPositive(keepalive.getPongTimeout()), "agent.keepalive.pong-timeout must be positive");
        require(apply.getMaxAttempts() > 0, "agent.apply.max-attempts must be > 0");
        require(apply.getRetryDelay() != null && !apply.getRetryDelay().isNegative(),
                "agent.apply.retry-delay must not be negative");

        log.info("Agent configured: gateway={}, subject={}, durable={}, batch={}, backoff={}..{}",
                gatewayUrl, subject, durable, batchSize, backoff.getBase(), backoff.getMax());
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException("Invalid agent configuration: " + message);
        }
    }
}
