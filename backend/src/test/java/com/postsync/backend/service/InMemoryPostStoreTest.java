package com.postsync.backend.service;

import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.NewPost;
import com.postsync.backend.domain.Post;
import com.postsync.backend.domain.PostChange;
import com.postsync.backend.domain.PostPatch;
import com.postsync.backend.domain.PostStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.postsync.backend.service.ServiceHarness.draft;
import static com.postsync.backend.service.ServiceHarness.draftWithId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryPostStoreTest {

    private final ServiceHarness h = new ServiceHarness();
    private final InMemoryPostStore store = h.posts;

    @Test
    void createAssignsIdVersionOneAndDefaults() {
        Post p = store.create(draft(1, "Opening"), ChangeSource.REPLICA).after();

        assertThat(p.postId()).isEqualTo("P1:1");
        assertThat(p.version()).isEqualTo(1);
        assertThat(p.status()).isEqualTo(PostStatus.PLANNED);
        assertThat(p.durationSeconds()).isEqualTo(60);
        assertThat(p.recordingDay()).isEqualTo("day1");
        assertThat(p.sortOrder()).isEqualTo(10);
        assertThat(p.lastModifiedBy()).isEqualTo(ChangeSource.REPLICA);
        assertThat(p.createdAt()).isEqualTo(h.clock.instant());

        Post second = store.create(draft(1, "Second"), ChangeSource.REPLICA).after();
        assertThat(second.postId()).isEqualTo("P1:2");
        assertThat(second.sortOrder()).isEqualTo(20);
    }

    @Test
    void createRejectsMissingOrUnknownGroup() {
        NewPost noGroup = new NewPost(null, null, null, null, "x", null, null, null, null, null, null, null, null, null);
        assertThatThrownBy(() -> store.create(noGroup, ChangeSource.API))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("group_id_required");
        assertThatThrownBy(() -> store.create(draft(9, "x"), ChangeSource.API))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("group_id_out_of_range");
    }

    @Test
    void updateBumpsVersionByExactlyOne() {
        Post p = store.create(draft(1, "Opening"), ChangeSource.REPLICA).after();
        h.clock.advance(Duration.ofMinutes(1));

        PostChange change = store.update(p.postId(), 1L, titlePatch("Renamed"), ChangeSource.API);

        assertThat(change.before().version()).isEqualTo(1);
        assertThat(change.after().version()).isEqualTo(2);
        assertThat(change.after().title()).isEqualTo("Renamed");
        assertThat(change.after().updatedAt()).isAfter(change.after().createdAt());
        assertThat(change.after().lastModifiedBy()).isEqualTo(ChangeSource.API);
    }

    @Test
    void staleVersionIsRejectedAndLeavesRecordUntouched() {
        Post p = store.create(draft(1, "Opening"), ChangeSource.REPLICA).after();
        store.update(p.postId(), 1L, titlePatch("v2"), ChangeSource.API);

        assertThatThrownBy(() -> store.update(p.postId(), 1L, titlePatch("stale"), ChangeSource.REPLICA))
                .isInstanceOfSatisfying(VersionConflictException.class, e -> {
                    assertThat(e.serverVersion()).isEqualTo(2);
                    assertThat(e.yourVersion()).isEqualTo(1);
                    assertThat(e.lastModifiedBy()).isEqualTo(ChangeSource.API);
                });
        assertThat(store.getById(p.postId()).title()).isEqualTo("v2");
        assertThat(store.getById(p.postId()).version()).isEqualTo(2);
    }

    @Test
    void forcedUpdateWithoutVersionStillBumps() {
        Post p = store.create(draft(2, "Choir"), ChangeSource.REPLICA).after();
        Post after = store.update(p.postId(), null, PostPatch.EMPTY, ChangeSource.SYSTEM).after();
        assertThat(after.version()).isEqualTo(2);
    }

    @Test
    void concurrentWritersWithSameVersionHaveExactlyOneWinner() throws Exception {
        Post p = store.create(draft(1, "Race"), ChangeSource.REPLICA).after();
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String title = "writer-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.update(p.postId(), 1L, titlePatch(title), ChangeSource.API);
                        return true;
                    } catch (VersionConflictException e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get(10, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
            assertThat(store.getById(p.postId()).version()).isEqualTo(2);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void softDeleteMovesToTrashAndRestoreBringsItBackWithHigherVersion() {
        Post p = store.create(draft(1, "Trash me"), ChangeSource.REPLICA).after();

        Post tomb = store.softDelete(p.postId(), 1L, "alice", ChangeSource.API).after();
        assertThat(tomb.deleted()).isTrue();
        assertThat(tomb.deletedBy()).isEqualTo("alice");
        assertThat(tomb.version()).isEqualTo(2);
        assertThat(store.exists(p.postId())).isFalse();
        assertThat(store.isTrashed(p.postId())).isTrue();
        assertThat(store.listActive()).isEmpty();
        assertThatThrownBy(() -> store.getById(p.postId())).isInstanceOf(PostNotFoundException.class);
        assertThat(store.getById(p.postId(), true).deletedAt()).isNotNull();

        Post restored = store.restore(p.postId(), ChangeSource.API).after();
        assertThat(restored.deleted()).isFalse();
        assertThat(restored.version()).isEqualTo(3);
        assertThat(store.listTrash()).isEmpty();
    }

    @Test
    void softDeleteChecksVersion() {
        Post p = store.create(draft(1, "x"), ChangeSource.REPLICA).after();
        store.update(p.postId(), null, titlePatch("y"), ChangeSource.API);

        assertThatThrownBy(() -> store.softDelete(p.postId(), 1L, null, ChangeSource.REPLICA))
                .isInstanceOf(VersionConflictException.class);
        assertThat(store.exists(p.postId())).isTrue();
    }

    @Test
    void idsAreNeverReusedEvenAfterPurge() {
        Post p = store.create(draftWithId("P1:7", 1, "custom"), ChangeSource.REPLICA).after();
        store.hardDelete(p.postId());

        assertThatThrownBy(() -> store.create(draftWithId("P1:7", 1, "again"), ChangeSource.REPLICA))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("post_id_already_used");
    }

    @Test
    void rejectedDraftDoesNotUseUpItsRequestedId() {
        NewPost bad = new NewPost("SHEET-7", 1, null, null, "late", null, null, null, null, null, null,
                null, "25:99", null);
        assertThatThrownBy(() -> store.create(bad, ChangeSource.REPLICA))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("invalid_recording_time");
        assertThat(store.exists("SHEET-7")).isFalse();

        NewPost fixed = new NewPost("SHEET-7", 1, null, null, "late", null, null, null, null, null, null,
                null, "10:00", null);
        Post created = store.create(fixed, ChangeSource.REPLICA).after();

        assertThat(created.postId()).isEqualTo("SHEET-7");
        assertThat(created.version()).isEqualTo(1);
    }

    @Test
    void generatedIdsSkipIdsClaimedByClients() {
        store.create(draftWithId("P1:1", 1, "claimed"), ChangeSource.REPLICA);
        Post generated = store.create(draft(1, "generated"), ChangeSource.REPLICA).after();
        assertThat(generated.postId()).isEqualTo("P1:2");
    }

    @Test
    void purgeTrashRemovesOnlyExpiredTombstones() {
        Post old = store.create(draft(1, "old"), ChangeSource.REPLICA).after();
        store.softDelete(old.postId(), null, null, ChangeSource.API);
        h.clock.advance(Duration.ofDays(31));
        Post fresh = store.create(draft(1, "fresh"), ChangeSource.REPLICA).after();
        store.softDelete(fresh.postId(), null, null, ChangeSource.API);

        List<PostChange> purged = store.purgeTrash(h.clock.instant().minus(Duration.ofDays(30)));

        assertThat(purged).extracting(PostChange::postId).containsExactly(old.postId());
        assertThat(store.isTrashed(fresh.postId())).isTrue();
    }

    @Test
    void listIsOrderedByGroupThenSortOrder() {
        store.create(draft(2, "b1"), ChangeSource.REPLICA);
        store.create(draft(1, "a1"), ChangeSource.REPLICA);
        store.create(new NewPost(null, 1, 5, null, "a0", null, null, null, null, null, null, null, null, null),
                ChangeSource.REPLICA);

        assertThat(store.listActive()).extracting(Post::title).containsExactly("a0", "a1", "b1");
    }

    @Test
    void renumberRewritesSortOrdersAndBumpsOnlyMovedPosts() {
        store.create(new NewPost(null, 1, 10, null, "a", null, null, null, null, null, null, null, null, null), ChangeSource.API);
        store.create(new NewPost(null, 1, 15, null, "b", null, null, null, null, null, null, null, null, null), ChangeSource.API);
        store.create(new NewPost(null, 1, 99, null, "c", null, null, null, null, null, null, null, null, null), ChangeSource.API);

        List<PostChange> changes = store.renumber(1, ChangeSource.API);

        assertThat(changes).hasSize(2);
        assertThat(store.listByGroup(1)).extracting(Post::sortOrder).containsExactly(10, 20, 30);
        assertThat(store.listByGroup(1)).extracting(Post::version).containsExactly(1L, 2L, 2L);
    }

    @Test
    void validationRejectsBadFieldsWithoutChangingVersion() {
        Post p = store.create(draft(1, "x"), ChangeSource.REPLICA).after();
        PostPatch badDay = new PostPatch(null, null, null, null, null, null, null, null, null, null, "monday", null, null);
        PostPatch negative = new PostPatch(null, null, null, null, -5, null, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> store.update(p.postId(), 1L, badDay, ChangeSource.API))
                .hasMessageContaining("invalid_recording_day");
        assertThatThrownBy(() -> store.update(p.postId(), 1L, negative, ChangeSource.API))
                .hasMessageContaining("duration_seconds_negative");
        assertThat(store.getById(p.postId()).version()).isEqualTo(1);
    }

    @Test
    void importLiftsVersionsAboveAnythingIssued() {
        Post p = store.create(draft(1, "x"), ChangeSource.REPLICA).after();
        store.update(p.postId(), null, titlePatch("y"), ChangeSource.API);
        store.update(p.postId(), null, titlePatch("z"), ChangeSource.API);

        // an older backup still holding version 1
        store.replaceAll(List.of(p), List.of());

        assertThat(store.getById(p.postId()).title()).isEqualTo("x");
        assertThat(store.getById(p.postId()).version()).isEqualTo(4);
    }

    private static PostPatch titlePatch(String title) {
        return new PostPatch(null, null, null, title, null, null, null, null, null, null, null, null, null);
    }
}
