package com.postsync.backend.service;

import com.postsync.backend.config.PostSyncProperties;
import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.NewPost;
import com.postsync.backend.domain.Post;
import com.postsync.backend.domain.PostChange;
import com.postsync.backend.domain.PostPatch;
import com.postsync.backend.domain.PostStatus;
import com.postsync.backend.repo.InMemoryStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

@Service
public class InMemoryPostStore implements PostStore {

    private static final Pattern RECORDING_DAY = Pattern.compile("day[1-9]");
    private static final Pattern RECORDING_TIME = Pattern.compile("([01]\\d|2[0-3]):[0-5]\\d(:[0-5]\\d)?");
    private static final int SORT_STEP = 10;
    private static final int DEFAULT_DURATION = 60;

    private final InMemoryStore store;
    private final Clock clock;
    private final int groupCount;
    // soft delete and restore nest compute() on both maps in opposite orders
    private final Object trashLock = new Object();

    public InMemoryPostStore(InMemoryStore store, Clock clock, PostSyncProperties props) {
        this.store = store;
        this.clock = clock;
        this.groupCount = props.groups().count();
    }

    // =========================
    // create
    // =========================
    @Override
    public PostChange create(NewPost draft, ChangeSource source) {
        if (draft == null) throw new ValidationException("body_required");
        if (draft.groupId() == null) throw new ValidationException("group_id_required");
        requireGroup(draft.groupId());

        String id = claimId(draft.postId(), draft.groupId());
        Instant now = clock.instant();

        Post post = new Post(
                id,
                draft.groupId(),
                draft.sortOrder() != null ? draft.sortOrder() : nextSortOrder(draft.groupId()),
                blankToNull(draft.typeKey()),
                draft.title(),
                draft.durationSeconds() != null ? draft.durationSeconds() : DEFAULT_DURATION,
                draft.location(),
                draft.notes(),
                draft.participantIds(),
                draft.textAuthor(),
                draft.composer(),
                draft.recordingDay() != null ? draft.recordingDay() : "day1",
                draft.recordingTime(),
                draft.status() != null ? draft.status() : PostStatus.PLANNED,
                1L,
                source,
                now,
                now,
                null,
                null
        );
        try {
            validate(post);
        } catch (ValidationException e) {
            // a rejected draft leaves the store untouched; generated ids are simply skipped
            if (isRequested(draft.postId())) store.issuedIds.remove(id);
            throw e;
        }

        store.insertionOrder.put(id, store.insertionSeq.incrementAndGet());
        store.versionHighWater.merge(id, 1L, Math::max);
        store.activePosts.put(id, post);
        return new PostChange(null, post);
    }

    private String claimId(String requested, int groupId) {
        if (isRequested(requested)) {
            String id = requested.trim();
            if (!store.issuedIds.add(id)) throw new ValidationException("post_id_already_used: " + id);
            return id;
        }
        AtomicInteger seq = store.groupSequences.computeIfAbsent(groupId, g -> new AtomicInteger());
        while (true) {
            String candidate = "P" + groupId + ":" + seq.incrementAndGet();
            if (store.issuedIds.add(candidate)) return candidate;
        }
    }

    private static boolean isRequested(String requested) {
        return requested != null && !requested.isBlank();
    }

    private int nextSortOrder(int groupId) {
        return store.activePosts.values().stream()
                .filter(p -> p.groupId() == groupId)
                .mapToInt(Post::sortOrder)
                .max()
                .orElse(0) + SORT_STEP;
    }

    // =========================
    // update (compare-and-swap on version)
    // =========================
    @Override
    public PostChange update(String postId, Long expectedVersion, PostPatch patch, ChangeSource source) {
        PostPatch p = patch != null ? patch : PostPatch.EMPTY;
        Post[] before = new Post[1];

        Post after = store.activePosts.compute(requireId(postId), (id, cur) -> {
            if (cur == null) throw new PostNotFoundException(id);
            checkVersion(cur, expectedVersion);
            long version = nextVersion(cur);
            Post next = p.applyTo(cur, version, source, clock.instant());
            validate(next);
            issueVersion(id, version);
            before[0] = cur;
            return next;
        });
        return new PostChange(before[0], after);
    }

    private void checkVersion(Post current, Long expectedVersion) {
        if (expectedVersion != null && expectedVersion < current.version()) {
            throw new VersionConflictException(current.postId(), current.version(), expectedVersion,
                    current.lastModifiedBy(), current.updatedAt());
        }
    }

    // called inside compute() for the post's own key only
    private long nextVersion(Post current) {
        long floor = store.versionHighWater.getOrDefault(current.postId(), current.version());
        return Math.max(floor, current.version()) + 1;
    }

    private void issueVersion(String postId, long version) {
        store.versionHighWater.merge(postId, version, Math::max);
    }

    // =========================
    // soft delete / restore / hard delete
    // =========================
    @Override
    public PostChange softDelete(String postId, Long expectedVersion, String deletedBy, ChangeSource source) {
        Post[] result = new Post[2];
        synchronized (trashLock) {
            store.activePosts.compute(requireId(postId), (id, cur) -> {
                if (cur == null) throw new PostNotFoundException(id);
                checkVersion(cur, expectedVersion);
                Instant now = clock.instant();
                Post tombstone = cur.withVersion(nextVersion(cur), source, now)
                        .asDeleted(now, deletedBy != null ? deletedBy : source.wire());
                issueVersion(id, tombstone.version());
                store.trash.put(id, tombstone);
                result[0] = cur;
                result[1] = tombstone;
                return null;
            });
        }
        return new PostChange(result[0], result[1]);
    }

    @Override
    public PostChange restore(String postId, ChangeSource source) {
        Post[] result = new Post[2];
        synchronized (trashLock) {
            store.trash.compute(requireId(postId), (id, tomb) -> {
                if (tomb == null) throw new PostNotFoundException(id);
                Post restored = tomb.asRestored().withVersion(nextVersion(tomb), source, clock.instant());
                issueVersion(id, restored.version());
                store.activePosts.put(id, restored);
                result[0] = tomb;
                result[1] = restored;
                return null;
            });
        }
        return new PostChange(result[0], result[1]);
    }

    @Override
    public PostChange hardDelete(String postId) {
        String id = requireId(postId);
        Post removed = store.activePosts.remove(id);
        if (removed == null) removed = store.trash.remove(id);
        if (removed == null) throw new PostNotFoundException(id);
        store.insertionOrder.remove(id);
        return new PostChange(removed, null);
    }

    @Override
    public List<PostChange> purgeTrash(Instant deletedBefore) {
        List<PostChange> purged = new ArrayList<>();
        for (Post tomb : store.trash.values()) {
            if (tomb.deletedAt() != null && tomb.deletedAt().isBefore(deletedBefore)
                    && store.trash.remove(tomb.postId(), tomb)) {
                store.insertionOrder.remove(tomb.postId());
                purged.add(new PostChange(tomb, null));
            }
        }
        return purged;
    }

    // =========================
    // reads
    // =========================
    @Override
    public Optional<Post> findById(String postId) {
        if (postId == null) return Optional.empty();
        return Optional.ofNullable(store.activePosts.get(postId));
    }

    @Override
    public Post getById(String postId) {
        return getById(postId, false);
    }

    @Override
    public Post getById(String postId, boolean includeDeleted) {
        String id = requireId(postId);
        Post p = store.activePosts.get(id);
        if (p == null && includeDeleted) p = store.trash.get(id);
        if (p == null) throw new PostNotFoundException(id);
        return p;
    }

    @Override
    public boolean exists(String postId) {
        return postId != null && store.activePosts.containsKey(postId);
    }

    @Override
    public boolean isTrashed(String postId) {
        return postId != null && store.trash.containsKey(postId);
    }

    @Override
    public List<Post> listActive() {
        return store.activePosts.values().stream().sorted(order()).toList();
    }

    @Override
    public List<Post> listByGroup(int groupId) {
        return store.activePosts.values().stream()
                .filter(p -> p.groupId() == groupId)
                .sorted(order())
                .toList();
    }

    @Override
    public List<Post> listTrash() {
        return store.trash.values().stream()
                .sorted(Comparator.comparing(Post::deletedAt).reversed())
                .toList();
    }

    private Comparator<Post> order() {
        return Comparator.comparingInt(Post::groupId)
                .thenComparingInt(Post::sortOrder)
                .thenComparingLong(p -> store.insertionOrder.getOrDefault(p.postId(), Long.MAX_VALUE));
    }

    // =========================
    // renumber
    // =========================
    @Override
    public List<PostChange> renumber(int groupId, ChangeSource source) {
        requireGroup(groupId);
        List<PostChange> changes = new ArrayList<>();
        List<Post> ordered = listByGroup(groupId);
        for (int i = 0; i < ordered.size(); i++) {
            Post p = ordered.get(i);
            int target = (i + 1) * SORT_STEP;
            if (p.sortOrder() == target) continue;
            try {
                changes.add(update(p.postId(), null, PostPatch.sortOrder(target), source));
            } catch (PostNotFoundException e) {
                // deleted while renumbering; nothing left to move
            }
        }
        return changes;
    }

    // =========================
    // export / import
    // =========================
    @Override
    public Snapshot snapshot() {
        return new Snapshot(listActive(), listTrash());
    }

    @Override
    public Snapshot replaceAll(List<Post> active, List<Post> trashed) {
        synchronized (trashLock) {
            return replaceAllLocked(active, trashed);
        }
    }

    private Snapshot replaceAllLocked(List<Post> active, List<Post> trashed) {
        Map<String, Post> nextActive = new LinkedHashMap<>();
        Map<String, Post> nextTrash = new LinkedHashMap<>();
        for (Post p : active != null ? active : List.<Post>of()) {
            nextActive.put(p.postId(), lift(p.asRestored()));
        }
        for (Post p : trashed != null ? trashed : List.<Post>of()) {
            if (nextActive.containsKey(p.postId())) continue;
            Post t = p.deleted() ? p : p.asDeleted(clock.instant(), ChangeSource.SYSTEM.wire());
            nextTrash.put(p.postId(), lift(t));
        }

        store.activePosts.clear();
        store.trash.clear();
        store.insertionOrder.clear();
        for (Post p : nextActive.values()) {
            store.issuedIds.add(p.postId());
            store.insertionOrder.put(p.postId(), store.insertionSeq.incrementAndGet());
            store.activePosts.put(p.postId(), p);
        }
        for (Post p : nextTrash.values()) {
            store.issuedIds.add(p.postId());
            store.insertionOrder.put(p.postId(), store.insertionSeq.incrementAndGet());
            store.trash.put(p.postId(), p);
        }
        return snapshot();
    }

    // imported versions continue above anything already handed out for the id
    private Post lift(Post p) {
        Long seen = store.versionHighWater.get(p.postId());
        long version = seen == null ? Math.max(1L, p.version()) : Math.max(p.version(), seen + 1);
        store.versionHighWater.merge(p.postId(), version, Math::max);
        if (version == p.version()) return p;
        return new Post(p.postId(), p.groupId(), p.sortOrder(), p.typeKey(), p.title(), p.durationSeconds(),
                p.location(), p.notes(), p.participantIds(), p.textAuthor(), p.composer(), p.recordingDay(),
                p.recordingTime(), p.status(), version, p.lastModifiedBy(), p.createdAt(), p.updatedAt(),
                p.deletedAt(), p.deletedBy());
    }

    // =========================
    // validation
    // =========================
    private void validate(Post p) {
        requireGroup(p.groupId());
        if (p.durationSeconds() < 0) throw new ValidationException("duration_seconds_negative");
        if (p.status() == null) throw new ValidationException("status_required");
        if (p.recordingDay() != null && !RECORDING_DAY.matcher(p.recordingDay()).matches()) {
            throw new ValidationException("invalid_recording_day: " + p.recordingDay());
        }
        if (p.recordingTime() != null && !p.recordingTime().isBlank()
                && !RECORDING_TIME.matcher(p.recordingTime()).matches()) {
            throw new ValidationException("invalid_recording_time: " + p.recordingTime());
        }
    }

    private void requireGroup(int groupId) {
        if (groupId < 1 || groupId > groupCount) {
            throw new ValidationException("group_id_out_of_range: " + groupId);
        }
    }

    private static String requireId(String postId) {
        if (postId == null || postId.isBlank()) throw new ValidationException("post_id_required");
        return postId.trim();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
