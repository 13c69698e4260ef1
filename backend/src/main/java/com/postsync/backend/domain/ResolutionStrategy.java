package com.postsync.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a replica settles a reported conflict.
 * MERGE has no field-level semantics yet and is served exactly like USE_SERVER.
 */
public enum ResolutionStrategy {
    KEEP_LOCAL,
    USE_SERVER,
    MERGE;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResolutionStrategy fromWire(String value) {
        if (value == null) return null;
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ResolutionStrategy s : values()) {
            if (s.name().equals(v)) return s;
        }
        throw new IllegalArgumentException("unknown_strategy: " + value);
    }
}
