package com.postsync.backend.service;

import com.postsync.backend.domain.ChangeSource;

import java.time.Instant;

/**
 * A write carried a version older than the stored one. Routine under concurrent editing,
 * so it carries everything a resolver needs and is not logged as an error.
 */
public class VersionConflictException extends RuntimeException {

    private final String postId;
    private final long serverVersion;
    private final Long yourVersion;
    private final ChangeSource lastModifiedBy;
    private final Instant lastModifiedAt;

    public VersionConflictException(String postId, long serverVersion, Long yourVersion,
                                    ChangeSource lastModifiedBy, Instant lastModifiedAt) {
        super("Post has been modified since your last read");
        this.postId = postId;
        this.serverVersion = serverVersion;
        this.yourVersion = yourVersion;
        this.lastModifiedBy = lastModifiedBy;
        this.lastModifiedAt = lastModifiedAt;
    }

    public String postId() {
        return postId;
    }

    public long serverVersion() {
        return serverVersion;
    }

    public Long yourVersion() {
        return yourVersion;
    }

    public ChangeSource lastModifiedBy() {
        return lastModifiedBy;
    }

    public Instant lastModifiedAt() {
        return lastModifiedAt;
    }
}
