package com.containermgmt.streamagent.dto;

/**
 * Identifies the stream this agent consumes: one subject/durable pair per process.
 */
public record SubscriptionDescriptor(String subject, String durable, int batchSize) {

    public SubscriptionDescriptor {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        if (durable == null || durable.isBlank()) {
            throw new IllegalArgumentException("durable must not be blank");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
        }
    }
}
