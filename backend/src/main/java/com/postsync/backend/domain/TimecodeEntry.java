package com.postsync.backend.domain;

import java.time.Instant;

public record TimecodeEntry(
        String id,
        String postId,
        String operator,
        String tcIn,    // HH:MM:SS:FF
        String tcOut,
        Integer clipNr,
        Integer durationSeconds,
        Instant createdAt
) {
    public TimecodeEntry close(String tcOut, int durationSeconds) {
        return new TimecodeEntry(id, postId, operator, tcIn, tcOut, clipNr, durationSeconds, createdAt);
    }

    public boolean open() {
        return tcOut == null;
    }
}
