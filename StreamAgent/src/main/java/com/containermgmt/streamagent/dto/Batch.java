package com.containermgmt.streamagent.dto;

import java.util.List;

/**
 * Unit of acknowledgement. Events keep the order they had on the wire and are
 * acked all together or not at all.
 */
public record Batch(String batchId, String ackToken, List<ChangeEvent> events) {

    public Batch {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public int size() {
        return events.size();
    }
}
