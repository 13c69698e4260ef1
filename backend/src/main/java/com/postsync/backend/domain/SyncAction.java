package com.postsync.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SyncAction {
    CREATE,
    UPDATE,
    DELETE,
    RESTORE,
    BATCH_SYNC;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SyncAction fromWire(String value) {
        if (value == null) return null;
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (SyncAction a : values()) {
            if (a.name().equals(v)) return a;
        }
        throw new IllegalArgumentException("unknown_action: " + value);
    }
}
