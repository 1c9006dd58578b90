package com.containermgmt.streamagent.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single event as delivered by the gateway. {@code sequence} is assigned by the
 * broker and is the ordering key for {@code entityId}.
 *
 * @param kind     decoded event kind
 * @param rawKind  kind string as received, kept for logging unknown kinds
 * @param entityId key of the entity the event applies to
 * @param payload  field values; never null
 * @param sequence broker sequence number, non-negative
 */
public record ChangeEvent(EventKind kind, String rawKind, String entityId,
                          Map<String, Object> payload, long sequence) {

    public ChangeEvent {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static ChangeEvent upsert(String entityId, Map<String, Object> payload, long sequence) {
        return new ChangeEvent(EventKind.UPSERT, EventKind.UPSERT.wireName(), entityId, payload, sequence);
    }

    public static ChangeEvent delete(String entityId, long sequence) {
        return new ChangeEvent(EventKind.DELETE, EventKind.DELETE.wireName(), entityId, Map.of(), sequence);
    }
}
