package com.postsync.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.postsync.backend.domain.*;
import com.postsync.backend.service.cache.ReadThroughCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Reconciles changes coming from any client against the post store.
 *
 * <p>Every write goes store first; only once the store accepted it is a
 * {@link PostChangedEvent} published for audit, cache invalidation, sync status and
 * webhooks. A stale version is answered with {@link VersionConflictException} and leaves
 * the store untouched.
 */
@Service
public class SyncCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SyncCoordinator.class);

    @FunctionalInterface
    interface SyncHandler {
        Object handle(SyncPayload payload, ChangeSource source, String actor);
    }

    private final PostStore posts;
    private final SyncStatusTracker syncStatus;
    private final ReferenceDataService referenceData;
    private final ReadThroughCache cache;
    private final ApplicationEventPublisher events;
    private final ObjectMapper om;
    private final Map<SyncAction, SyncHandler> handlers = new EnumMap<>(SyncAction.class);

    public SyncCoordinator(PostStore posts,
                           SyncStatusTracker syncStatus,
                           ReferenceDataService referenceData,
                           ReadThroughCache cache,
                           ApplicationEventPublisher events,
                           ObjectMapper om) {
        this.posts = posts;
        this.syncStatus = syncStatus;
        this.referenceData = referenceData;
        this.cache = cache;
        this.events = events;
        this.om = om;

        handlers.put(SyncAction.CREATE, (p, src, actor) -> create(readDraft(p.data()), src, actor));
        handlers.put(SyncAction.UPDATE, (p, src, actor) -> update(requirePostId(p.data()), clientVersion(p),
                readPatch(p.data()), src, actor));
        handlers.put(SyncAction.DELETE, (p, src, actor) -> delete(requirePostId(p.data()), clientVersion(p), src, actor));
        handlers.put(SyncAction.RESTORE, (p, src, actor) -> restore(requirePostId(p.data()), src, actor));
        handlers.put(SyncAction.BATCH_SYNC, (p, src, actor) -> batchSync(p.data(), src, actor));
        for (SyncAction a : SyncAction.values()) {
            if (!handlers.containsKey(a)) throw new IllegalStateException("no handler for " + a);
        }
    }

    // =========================
    // payload entry points
    // =========================

    /** Full-access sync used by the tabular replica. */
    public Object handle(SyncPayload payload, ChangeSource source, String actor) {
        requirePostEntity(payload);
        return handlers.get(payload.action()).handle(payload, source, actor);
    }

    /** Display clients may only move status and notes. */
    public Post handleDisplayClient(SyncPayload payload, String actor) {
        requirePostEntity(payload);
        if (payload.action() != SyncAction.UPDATE) {
            throw new ValidationException("invalid_action_for_display_client: " + payload.action().wire());
        }
        JsonNode data = payload.data();
        String notes = data.hasNonNull("notes") ? data.get("notes").asText() : null;
        PostStatus status = data.hasNonNull("status") ? parseStatus(data.get("status").asText()) : null;
        return update(requirePostId(data), clientVersion(payload),
                PostPatch.statusAndNotes(status, notes), ChangeSource.DISPLAY_CLIENT, actor);
    }

    private static void requirePostEntity(SyncPayload payload) {
        if (payload == null) throw new ValidationException("body_required");
        if (payload.action() == null) throw new ValidationException("action_required");
        if (payload.data() == null || payload.data().isNull()) throw new ValidationException("data_required");
        String type = payload.entityType() == null ? SyncStatusTracker.POST : payload.entityType();
        if (!SyncStatusTracker.POST.equalsIgnoreCase(type)) {
            throw new ValidationException("unsupported_entity_type: " + type);
        }
    }

    // =========================
    // single-record operations
    // =========================
    public Post create(NewPost draft, ChangeSource source, String actor) {
        PostChange change = posts.create(withTemplateDefaults(draft), source);
        publish(ChangeKind.CREATE, change, source, actor);
        return change.after();
    }

    public Post update(String postId, Long clientVersion, PostPatch patch, ChangeSource source, String actor) {
        Post current = posts.getById(postId);
        if (clientVersion != null && clientVersion < current.version()) {
            throw conflict(current, clientVersion, source, patch);
        }
        PostChange change;
        try {
            change = posts.update(postId, clientVersion, patch, source);
        } catch (VersionConflictException lostRace) {
            recordConflict(lostRace, source, patch);
            throw lostRace;
        }
        publish(ChangeKind.UPDATE, change, source, actor);
        return change.after();
    }

    public Post changeStatus(String postId, PostStatus status, Long clientVersion, ChangeSource source, String actor) {
        if (status == null) throw new ValidationException("status_required");
        return update(postId, clientVersion, PostPatch.status(status), source, actor);
    }

    public Post delete(String postId, Long clientVersion, ChangeSource source, String actor) {
        PostChange change;
        try {
            change = posts.softDelete(postId, clientVersion, actor != null ? actor : source.wire(), source);
        } catch (VersionConflictException e) {
            recordConflict(e, source, null);
            throw e;
        }
        publish(ChangeKind.DELETE, change, source, actor);
        return change.after();
    }

    public Post restore(String postId, ChangeSource source, String actor) {
        PostChange change = posts.restore(postId, source);
        publish(ChangeKind.RESTORE, change, source, actor);
        return change.after();
    }

    /** Permanently removes a post (active or trashed). Its id stays retired. */
    public void purge(String postId, ChangeSource source, String actor) {
        PostChange change = posts.hardDelete(postId);
        publish(ChangeKind.PURGE, change, source, actor);
    }

    public int purgeTrash(Instant deletedBefore) {
        List<PostChange> purged = posts.purgeTrash(deletedBefore);
        purged.forEach(c -> publish(ChangeKind.PURGE, c, ChangeSource.SYSTEM, "trash-retention"));
        return purged.size();
    }

    public List<Post> renumber(int groupId, ChangeSource source, String actor) {
        List<PostChange> changes = posts.renumber(groupId, source);
        changes.forEach(c -> publish(ChangeKind.RENUMBER, c, source, actor));
        return posts.listByGroup(groupId);
    }

    // =========================
    // batches
    // =========================

    /**
     * Create-or-update for each element independently. One stale or broken record never
     * blocks the rest: conflicts and errors are collected and the loop moves on.
     */
    public BatchSyncResult batchSync(JsonNode data, ChangeSource source, String actor) {
        if (data == null || !data.isArray()) throw new ValidationException("batch_data_must_be_array");

        int created = 0;
        int updated = 0;
        List<String> conflicts = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (JsonNode item : data) {
            String id = item.hasNonNull("post_id") ? item.get("post_id").asText() : null;
            try {
                if (!item.isObject()) throw new ValidationException("record_must_be_object");
                if (id != null && posts.exists(id)) {
                    update(id, versionIn(item), readPatch(item), source, actor);
                    updated++;
                } else if (id != null && posts.isTrashed(id)) {
                    throw new ValidationException("post_in_trash");
                } else {
                    create(readDraft(item), source, actor);
                    created++;
                }
            } catch (VersionConflictException e) {
                conflicts.add(e.postId());
            } catch (ValidationException | PostNotFoundException e) {
                errors.add(label(id) + ": " + e.getMessage());
            } catch (RuntimeException e) {
                log.warn("batch record {} failed", label(id), e);
                errors.add(label(id) + ": " + e.getMessage());
            }
        }
        log.info("batch_sync from {}: created={} updated={} conflicts={} errors={}",
                source.wire(), created, updated, conflicts.size(), errors.size());
        return new BatchSyncResult(created, updated, conflicts, errors);
    }

    /** Update-only batch for the gateway; unknown ids are errors, not creates. */
    public BatchUpdateResult batchUpdate(List<JsonNode> items, ChangeSource source, String actor) {
        if (items == null) throw new ValidationException("updates_required");
        List<Post> updated = new ArrayList<>();
        List<String> conflicts = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (JsonNode item : items) {
            String id = item != null && item.hasNonNull("post_id") ? item.get("post_id").asText() : null;
            try {
                updated.add(update(requirePostId(item), versionIn(item), readPatch(item), source, actor));
            } catch (VersionConflictException e) {
                conflicts.add(e.postId());
            } catch (ValidationException | PostNotFoundException e) {
                errors.add(label(id) + ": " + e.getMessage());
            } catch (RuntimeException e) {
                log.warn("batch update of {} failed", label(id), e);
                errors.add(label(id) + ": " + e.getMessage());
            }
        }
        return new BatchUpdateResult(updated, conflicts, errors);
    }

    public Map<String, Object> batchGet(List<String> ids) {
        if (ids == null) throw new ValidationException("ids_required");
        List<Post> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String id : ids) {
            Optional<Post> p = posts.findById(id);
            if (p.isPresent()) found.add(p.get());
            else missing.add(id);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("posts", found);
        out.put("missing", missing);
        return out;
    }

    // =========================
    // conflict resolution
    // =========================
    public ResolutionResult resolve(String postId, ResolutionStrategy strategy, JsonNode data,
                                    ChangeSource source, String actor) {
        if (strategy == null) throw new ValidationException("strategy_required");
        ResolutionResult result;
        if (strategy == ResolutionStrategy.KEEP_LOCAL) {
            if (data == null || !data.isObject()) throw new ValidationException("data_required_for_keep_local");
            Post forced = update(postId, null, readPatch(data), source, actor);
            result = new ResolutionResult(postId, strategy, ResolutionStrategy.KEEP_LOCAL, forced);
        } else {
            // MERGE falls back to the authoritative copy
            result = new ResolutionResult(postId, strategy, ResolutionStrategy.USE_SERVER, posts.getById(postId));
        }
        syncStatus.clearConflict(SyncStatusTracker.POST, postId);
        return result;
    }

    // =========================
    // reads
    // =========================
    public PostVersion versionOf(String postId) {
        return cache.get(ReadThroughCache.postVersionKey(postId), () -> PostVersion.of(posts.getById(postId)));
    }

    // =========================
    // helpers
    // =========================
    private void publish(ChangeKind kind, PostChange change, ChangeSource source, String actor) {
        events.publishEvent(new PostChangedEvent(kind, change, source, actor != null ? actor : source.wire()));
    }

    private VersionConflictException conflict(Post current, long clientVersion, ChangeSource source, PostPatch patch) {
        VersionConflictException e = new VersionConflictException(current.postId(), current.version(),
                clientVersion, current.lastModifiedBy(), current.updatedAt());
        recordConflict(e, source, patch);
        return e;
    }

    private void recordConflict(VersionConflictException e, ChangeSource source, PostPatch patch) {
        log.debug("conflict on {}: client v{} < server v{} (source {})",
                e.postId(), e.yourVersion(), e.serverVersion(), source.wire());
        try {
            JsonNode captured = patch == null ? null : om.valueToTree(patch);
            syncStatus.recordConflict(SyncStatusTracker.POST, e.postId(), source, e.serverVersion(), captured);
        } catch (RuntimeException statusFailure) {
            log.warn("could not record conflict for {}", e.postId(), statusFailure);
        }
    }

    private NewPost withTemplateDefaults(NewPost d) {
        if (d == null || d.durationSeconds() != null || d.typeKey() == null) return d;
        return referenceData.findPostType(d.typeKey())
                .map(t -> new NewPost(d.postId(), d.groupId(), d.sortOrder(), d.typeKey(), d.title(),
                        t.defaultDurationSeconds(), d.location(), d.notes(), d.participantIds(), d.textAuthor(),
                        d.composer(), d.recordingDay(), d.recordingTime(), d.status()))
                .orElse(d);
    }

    private NewPost readDraft(JsonNode data) {
        return read(data, NewPost.class);
    }

    private PostPatch readPatch(JsonNode data) {
        return read(data, PostPatch.class);
    }

    private <T> T read(JsonNode data, Class<T> type) {
        if (data == null || !data.isObject()) throw new ValidationException("data_must_be_object");
        try {
            return om.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("malformed_data: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("malformed_data: " + e.getMessage());
        }
    }

    private static Long clientVersion(SyncPayload p) {
        return p.version() != null ? p.version() : versionIn(p.data());
    }

    /** Optional {@code version} field of a JSON body; non-integers are rejected. */
    public static Long versionIn(JsonNode node) {
        if (node == null || !node.hasNonNull("version")) return null;
        JsonNode v = node.get("version");
        if (!v.canConvertToLong()) throw new ValidationException("version_must_be_integer");
        return v.asLong();
    }

    private static String requirePostId(JsonNode data) {
        if (data == null || !data.hasNonNull("post_id") || data.get("post_id").asText().isBlank()) {
            throw new ValidationException("post_id_required");
        }
        return data.get("post_id").asText().trim();
    }

    static PostStatus parseStatus(String value) {
        try {
            return PostStatus.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    private static String label(String id) {
        return id != null ? id : "(new)";
    }
}
