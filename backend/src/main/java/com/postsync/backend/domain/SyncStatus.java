package com.postsync.backend.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

public record SyncStatus(
        String entityType,
        String entityId,
        Map<String, Instant> lastSync,   // source wire name -> last sync
        long dbVersion,
        boolean conflict,
        JsonNode conflictData,
        Instant createdAt,
        Instant updatedAt
) {
    public SyncStatus {
        lastSync = lastSync == null ? Map.of() : Map.copyOf(lastSync);
    }
}
