package com.postsync.backend.domain;

public record GroupStats(
        int groupId,
        int totalPosts,
        int planned,
        int recording,
        int recorded,
        int approved,
        long totalDurationSeconds,
        double progressPercent
) {}
