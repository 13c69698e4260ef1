package com.postsync.backend.domain;

public record ResolutionResult(
        String postId,
        ResolutionStrategy strategyRequested,
        ResolutionStrategy strategyApplied,
        Post post
) {}
