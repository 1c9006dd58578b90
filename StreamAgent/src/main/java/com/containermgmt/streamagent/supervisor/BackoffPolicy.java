package com.containermgmt.streamagent.supervisor;

import com.containermgmt.streamagent.config.AgentProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Reconnect delay: {@code min(base * 2^attempt, max)}, plus a random jitter in
 * {@code [0, delay/2]} when enabled.
 */
public class BackoffPolicy {

    private final Duration base;
    private final Duration max;
    private final boolean jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration max, boolean jitter) {
        this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in {@code [0, 1)}
     */
    public BackoffPolicy(Duration base, Duration max, boolean jitter, DoubleSupplier random) {
        if (base == null || base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive: " + base);
        }
        if (max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base: " + max);
        }
        this.base = base;
        this.max = max;
        this.jitter = jitter;
        this.random = random;
    }

    public static BackoffPolicy from(AgentProperties.Backoff backoff) {
        return new BackoffPolicy(backoff.getBase(), backoff.getMax(), backoff.isJitter());
    }

    /** Delay before reconnect number {@code attempt + 1}, without jitter. */
    public Duration baseDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0: " + attempt);
        }
        long maxMs = max.toMillis();
        long delayMs = base.toMillis();
        for (int i = 0; i < attempt && delayMs < maxMs; i++) {
            delayMs *= 2;
        }
        return Duration.ofMillis(Math.min(delayMs, maxMs));
    }

    public Duration delayFor(int attempt) {
        Duration delay = baseDelay(attempt);
        if (!jitter) {
            return delay;
        }
        long extraMs = (long) (random.getAsDouble() * (delay.toMillis() / 2.0));
        return delay.plusMillis(extraMs);
    }

    public Duration getBase() {
        return base;
    }

    public Duration getMax() {
        return max;
    }

    public boolean isJitter() {
        return jitter;
    }
}
