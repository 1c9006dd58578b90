package com.containermgmt.streamagent.dto;

import java.util.Locale;

/**
 * Event kinds understood by the store applier.
 * Kinds the agent does not know decode to {@link #UNKNOWN} and are skipped.
 */
public enum EventKind {

    UPSERT("file.upsert"),
    DELETE("file.delete"),
    UNKNOWN(null);

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Accepts both the namespaced form ("file.upsert") and the bare verb ("upsert").
     */
    public static EventKind fromWire(String kind) {
        if (kind == null) {
            return UNKNOWN;
        }
        String normalized = kind.trim().toLowerCase(Locale.ROOT);
        for (EventKind k : values()) {
            if (k.wireName == null) {
                continue;
            }
            if (k.wireName.equals(normalized) || k.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return k;
            }
        }
        return UNKNOWN;
    }
}
