package com.postsync.backend.domain;

/**
 * Template for a kind of post (sermon, reading, choir...). Read through the cache.
 */
public record PostType(
        String typeKey,
        String displayName,
        int defaultDurationSeconds,
        String icon,
        String category,
        boolean requiresPeople
) {}
