package com.postsync.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which kind of client produced a mutation. Stamped on posts as {@code last_modified_by}
 * and used to skip echoing a change back to the replica that made it.
 */
public enum ChangeSource {
    REPLICA("replica"),
    API("api"),
    CONTROL_SYSTEM("control-system"),
    DISPLAY_CLIENT("display-client"),
    SYSTEM("system");

    private final String wire;

    ChangeSource(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ChangeSource fromWire(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ChangeSource s : values()) {
            if (s.wire.equals(v)) return s;
        }
        throw new IllegalArgumentException("unknown_source: " + value);
    }
}
