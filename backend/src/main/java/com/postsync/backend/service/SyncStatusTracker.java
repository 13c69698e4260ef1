package com.postsync.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.SyncStatus;
import com.postsync.backend.repo.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Per-entity sync bookkeeping. Rows are created on the first attempt and kept forever
 * for diagnostics.
 */
@Service
public class SyncStatusTracker {

    public static final String POST = "post";

    private static final Logger log = LoggerFactory.getLogger(SyncStatusTracker.class);

    private final InMemoryStore store;
    private final Clock clock;

    public SyncStatusTracker(InMemoryStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public SyncStatus recordSuccess(String entityType, String entityId, ChangeSource source, long version) {
        Instant now = clock.instant();
        return store.syncStatus.compute(key(entityType, entityId), (k, cur) -> {
            Map<String, Instant> last = new HashMap<>(cur == null ? Map.of() : cur.lastSync());
            last.put(source.wire(), now);
            return new SyncStatus(entityType, entityId, last, version, false, null,
                    cur == null ? now : cur.createdAt(), now);
        });
    }

    public SyncStatus recordConflict(String entityType, String entityId, ChangeSource source,
                                     long serverVersion, JsonNode payload) {
        Instant now = clock.instant();
        return store.syncStatus.compute(key(entityType, entityId), (k, cur) -> {
            Map<String, Instant> last = new HashMap<>(cur == null ? Map.of() : cur.lastSync());
            last.put(source.wire(), now);
            return new SyncStatus(entityType, entityId, last, serverVersion, true, payload,
                    cur == null ? now : cur.createdAt(), now);
        });
    }

    public Optional<SyncStatus> clearConflict(String entityType, String entityId) {
        Instant now = clock.instant();
        return Optional.ofNullable(store.syncStatus.computeIfPresent(key(entityType, entityId), (k, cur) ->
                new SyncStatus(cur.entityType(), cur.entityId(), cur.lastSync(), cur.dbVersion(), false, null,
                        cur.createdAt(), now)));
    }

    public Optional<SyncStatus> find(String entityType, String entityId) {
        return Optional.ofNullable(store.syncStatus.get(key(entityType, entityId)));
    }

    public List<SyncStatus> list(String entityType, Boolean conflictOnly) {
        return store.syncStatus.values().stream()
                .filter(s -> entityType == null || entityType.isBlank() || s.entityType().equalsIgnoreCase(entityType))
                .filter(s -> conflictOnly == null || !conflictOnly || s.conflict())
                .sorted(Comparator.comparing(SyncStatus::updatedAt).reversed())
                .toList();
    }

    public List<SyncStatus> all() {
        return List.copyOf(store.syncStatus.values());
    }

    public void replaceAll(Collection<SyncStatus> rows) {
        store.syncStatus.clear();
        if (rows == null) return;
        for (SyncStatus s : rows) store.syncStatus.put(key(s.entityType(), s.entityId()), s);
    }

    @Order(3)
    @EventListener
    public void onPostChanged(PostChangedEvent event) {
        try {
            recordSuccess(POST, event.postId(), event.source(), event.change().version());
        } catch (RuntimeException e) {
            log.warn("sync status update failed for {}", event.postId(), e);
        }
    }

    private static String key(String entityType, String entityId) {
        return entityType + ":" + entityId;
    }
}
