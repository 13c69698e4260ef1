package com.postsync.backend.domain;

import java.time.Instant;

public record PostVersion(String postId, long version, ChangeSource lastModifiedBy, Instant updatedAt) {

    public static PostVersion of(Post p) {
        return new PostVersion(p.postId(), p.version(), p.lastModifiedBy(), p.updatedAt());
    }
}
