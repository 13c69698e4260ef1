package com.postsync.backend.domain;

/**
 * Result of a committed store mutation. {@code before} is null for creates,
 * {@code after} is null for hard deletes.
 */
public record PostChange(Post before, Post after) {

    public String postId() {
        return after != null ? after.postId() : before.postId();
    }

    public long version() {
        return after != null ? after.version() : before.version();
    }
}
