package com.postsync.backend.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChangeKind {
    CREATE,
    UPDATE,
    DELETE,
    RESTORE,
    PURGE,
    RENUMBER;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
