package com.containermgmt.streamagent.codec;

import com.containermgmt.streamagent.dto.Batch;
import com.containermgmt.streamagent.dto.ChangeEvent;
import com.containermgmt.streamagent.dto.EventKind;
import com.containermgmt.streamagent.dto.GatewayFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gateway wire format: JSON text frames discriminated by {@code type}.
 *
 * <pre>
 * in:  {"type":"events","batch_id":"b1","ack_token":"t1",
 *       "events":[{"kind":"file.upsert","entity_id":"f42","sequence":5,"payload":{...}}]}
 * in:  {"type":"ping","nonce":"n"}   {"type":"pong","nonce":"n"}   {"type":"error","message":"..."}
 * out: {"type":"ack","ack_token":"t1"}   {"type":"pong","nonce":"n"}   {"type":"ping","nonce":"n"}
 * </pre>
 *
 * Decoding has no side effects and never reorders events.
 */
@Component
public class EventCodec {

    static final String TYPE = "type";
    static final String BATCH_ID = "batch_id";
    static final String ACK_TOKEN = "ack_token";
    static final String EVENTS = "events";
    static final String KIND = "kind";
    static final String ENTITY_ID = "entity_id";
    static final String SEQUENCE = "sequence";
    static final String PAYLOAD = "payload";
    static final String NONCE = "nonce";
    static final String MESSAGE = "message";

    private final ObjectMapper objectMapper;

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses one inbound text frame.
     *
     * @throws CodecException if the frame does not match the wire format
     */
    public GatewayFrame decode(String rawFrame) {
        if (rawFrame == null || rawFrame.isBlank()) {
            throw new CodecException("empty frame", rawFrame);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(rawFrame);
        } catch (JsonProcessingException e) {
            throw new CodecException("frame is not valid JSON: " + e.getOriginalMessage(), rawFrame, e);
        }
        if (root == null || !root.isObject()) {
            throw new CodecException("frame is not a JSON object", rawFrame);
        }

        String type = text(root, TYPE);
        if (type == null) {
            throw new CodecException("missing frame type", rawFrame);
        }

        switch (type) {
            case "events":
            case "batch":
                return new GatewayFrame.BatchFrame(decodeBatch(root, rawFrame));
            case "ping":
                return new GatewayFrame.Ping(text(root, NONCE));
            case "pong":
                return new GatewayFrame.Pong(text(root, NONCE));
            case "error":
                String message = text(root, MESSAGE);
                return new GatewayFrame.GatewayError(message != null ? message : "(no message)");
            default:
                throw new CodecException("unknown frame type '" + type + "'", rawFrame);
        }
    }

    public String encodeAck(String ackToken) {
        if (ackToken == null || ackToken.isBlank()) {
            throw new IllegalArgumentException("ackToken must not be blank");
        }
        ObjectNode node = objectMapper.createObjectNode();
        node.put(TYPE, "ack");
        node.put(ACK_TOKEN, ackToken);
        return write(node);
    }

    public String encodePong(String nonce) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(TYPE, "pong");
        if (nonce != null) {
            node.put(NONCE, nonce);
        }
        return write(node);
    }

    public String encodePing(String nonce) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(TYPE, "ping");
        node.put(NONCE, nonce);
        return write(node);
    }

    private Batch decodeBatch(JsonNode root, String rawFrame) {
        String batchId = requiredText(root, BATCH_ID, rawFrame);
        String ackToken = requiredText(root, ACK_TOKEN, rawFrame);

        JsonNode eventsNode = root.get(EVENTS);
        if (eventsNode == null || !eventsNode.isArray()) {
            throw new CodecException("batch " + batchId + ": 'events' must be an array", rawFrame);
        }

        List<ChangeEvent> events = new ArrayList<>(eventsNode.size());
        for (int i = 0; i < eventsNode.size(); i++) {
            events.add(decodeEvent(eventsNode.get(i), batchId, i, rawFrame));
        }
        return new Batch(batchId, ackToken, events);
    }

    @SuppressWarnings("unchecked")
    private ChangeEvent decodeEvent(JsonNode node, String batchId, int index, String rawFrame) {
        String where = "batch " + batchId + " event #" + index;
        if (node == null || !node.isObject()) {
            throw new CodecException(where + " is not an object", rawFrame);
        }

        String rawKind = text(node, KIND);
        if (rawKind == null) {
            throw new CodecException(where + ": missing 'kind'", rawFrame);
        }

        JsonNode payloadNode = node.get(PAYLOAD);
        Map<String, Object> payload;
        if (payloadNode == null || payloadNode.isNull()) {
            payload = Map.of();
        } else if (payloadNode.isObject()) {
            payload = objectMapper.convertValue(payloadNode, Map.class);
        } else {
            throw new CodecException(where + ": 'payload' must be an object", rawFrame);
        }

        String entityId = text(node, ENTITY_ID);
        if (entityId == null) {
            Object path = payload.get("path");
            entityId = path != null && !path.toString().isBlank() ? path.toString() : null;
        }
        if (entityId == null) {
            throw new CodecException(where + ": missing 'entity_id'", rawFrame);
        }

        JsonNode seqNode = node.get(SEQUENCE);
        if (seqNode == null || !seqNode.isIntegralNumber() || !seqNode.canConvertToLong()) {
            throw new CodecException(where + ": 'sequence' must be an integer", rawFrame);
        }
        long sequence = seqNode.longValue();
        if (sequence < 0) {
            throw new CodecException(where + ": 'sequence' must not be negative", rawFrame);
        }

        return new ChangeEvent(EventKind.fromWire(rawKind), rawKind, entityId, payload, sequence);
    }

    private String requiredText(JsonNode node, String field, String rawFrame) {
        String value = text(node, field);
        if (value == null) {
            throw new CodecException("missing '" + field + "'", rawFrame);
        }
        return value;
    }

    /** Non-blank textual (or numeric) field value, else null. */
    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !(value.isTextual() || value.isNumber())) {
            return null;
        }
        String s = value.asText();
        return s.isBlank() ? null : s;
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + node.get(TYPE) + " frame", e);
        }
    }
}
