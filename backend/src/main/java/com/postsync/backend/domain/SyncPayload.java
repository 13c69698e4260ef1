package com.postsync.backend.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Change pushed by a replica. {@code data} is a post object, or an array of them for
 * batch_sync. {@code version} may also travel inside {@code data}.
 */
public record SyncPayload(
        ChangeSource source,
        SyncAction action,
        String entityType,
        JsonNode data,
        Long version,
        Instant timestamp,
        String apiKey
) {}
