package com.postsync.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.postsync.backend.domain.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.postsync.backend.service.ServiceHarness.draft;
import static com.postsync.backend.service.ServiceHarness.draftWithId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncCoordinatorTest {

    private final ServiceHarness h = new ServiceHarness();
    private final SyncCoordinator coordinator = h.coordinator;

    @Test
    void staleReupdateIsRejectedWithServerVersion() throws Exception {
        Post x = coordinator.create(draft(1, "X"), ChangeSource.REPLICA, "sheet");
        assertThat(x.version()).isEqualTo(1);

        Post v2 = (Post) coordinator.handle(payload(SyncAction.UPDATE,
                "{\"post_id\":\"" + x.postId() + "\",\"title\":\"X2\"}", 1L), ChangeSource.REPLICA, "sheet");
        assertThat(v2.version()).isEqualTo(2);

        assertThatThrownBy(() -> coordinator.handle(payload(SyncAction.UPDATE,
                "{\"post_id\":\"" + x.postId() + "\",\"title\":\"X-stale\"}", 1L), ChangeSource.REPLICA, "sheet"))
                .isInstanceOfSatisfying(VersionConflictException.class,
                        e -> assertThat(e.serverVersion()).isEqualTo(2));

        SyncStatus status = h.syncStatus.find("post", x.postId()).orElseThrow();
        assertThat(status.conflict()).isTrue();
        assertThat(status.dbVersion()).isEqualTo(2);
        assertThat(status.conflictData().get("title").asText()).isEqualTo("X-stale");
    }

    @Test
    void versionMayTravelInsideData() throws Exception {
        Post x = coordinator.create(draft(1, "X"), ChangeSource.REPLICA, "sheet");
        coordinator.update(x.postId(), 1L, PostPatch.status(PostStatus.RECORDING), ChangeSource.API, "api");

        assertThatThrownBy(() -> coordinator.handle(payload(SyncAction.UPDATE,
                "{\"post_id\":\"" + x.postId() + "\",\"version\":1,\"notes\":\"n\"}", null), ChangeSource.REPLICA, "sheet"))
                .isInstanceOf(VersionConflictException.class);
    }

    @Test
    void batchSyncCollectsConflictsAndContinues() throws Exception {
        coordinator.create(draftWithId("A", 1, "a"), ChangeSource.REPLICA, "sheet");
        coordinator.create(draftWithId("B", 1, "b"), ChangeSource.REPLICA, "sheet");
        coordinator.update("B", 1L, PostPatch.status(PostStatus.RECORDED), ChangeSource.API, "api");

        JsonNode batch = h.om.readTree("""
                [
                  {"post_id":"A","version":1,"title":"a2"},
                  {"post_id":"B","version":1,"title":"b-stale"},
                  {"group_id":1,"title":"c"}
                ]
                """);
        BatchSyncResult result = (BatchSyncResult) coordinator.handle(
                new SyncPayload(ChangeSource.REPLICA, SyncAction.BATCH_SYNC, "post", batch, null, null, null),
                ChangeSource.REPLICA, "sheet");

        assertThat(result.created()).isEqualTo(1);
        assertThat(result.updated()).isEqualTo(1);
        assertThat(result.conflicts()).containsExactly("B");
        assertThat(result.errors()).isEmpty();
        assertThat(h.posts.getById("B").title()).isEqualTo("b");
        assertThat(h.posts.getById("A").title()).isEqualTo("a2");
    }

    @Test
    void batchSyncReportsTrashedAndInvalidRecordsAsErrors() throws Exception {
        coordinator.create(draftWithId("T", 1, "t"), ChangeSource.REPLICA, "sheet");
        coordinator.delete("T", null, ChangeSource.REPLICA, "sheet");

        JsonNode batch = h.om.readTree("""
                [{"post_id":"T","title":"zombie"}, {"group_id":42}, "not-an-object", {"group_id":2}]
                """);
        BatchSyncResult result = coordinator.batchSync(batch, ChangeSource.REPLICA, "sheet");

        assertThat(result.created()).isEqualTo(1);
        assertThat(result.errors()).hasSize(3);
        assertThat(result.errors().get(0)).contains("post_in_trash");
    }

    @Test
    void correctedRowIsAcceptedAfterValidationError() throws Exception {
        BatchSyncResult first = coordinator.batchSync(h.om.readTree("""
                [{"post_id":"B9","group_id":1,"recording_time":"25:99"}]
                """), ChangeSource.REPLICA, "sheet");
        assertThat(first.created()).isZero();
        assertThat(first.errors()).singleElement().asString().contains("invalid_recording_time");

        BatchSyncResult retry = coordinator.batchSync(h.om.readTree("""
                [{"post_id":"B9","group_id":1,"recording_time":"10:00"}]
                """), ChangeSource.REPLICA, "sheet");

        assertThat(retry.errors()).isEmpty();
        assertThat(retry.created()).isEqualTo(1);
        assertThat(h.posts.getById("B9").recordingTime()).isEqualTo("10:00");
    }

    @Test
    void displayClientMayOnlyChangeStatusAndNotes() throws Exception {
        Post x = coordinator.create(draft(1, "X"), ChangeSource.REPLICA, "sheet");

        Post updated = coordinator.handleDisplayClient(payload(SyncAction.UPDATE,
                "{\"post_id\":\"" + x.postId() + "\",\"status\":\"recording\",\"notes\":\"live\",\"title\":\"hijack\"}",
                1L), "tablet-1");

        assertThat(updated.status()).isEqualTo(PostStatus.RECORDING);
        assertThat(updated.notes()).isEqualTo("live");
        assertThat(updated.title()).isEqualTo("X");
        assertThat(updated.lastModifiedBy()).isEqualTo(ChangeSource.DISPLAY_CLIENT);

        assertThatThrownBy(() -> coordinator.handleDisplayClient(payload(SyncAction.DELETE,
                "{\"post_id\":\"" + x.postId() + "\"}", null), "tablet-1"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("invalid_action_for_display_client");
    }

    @Test
    void unknownEntityTypeIsRejected() throws Exception {
        SyncPayload p = new SyncPayload(ChangeSource.REPLICA, SyncAction.CREATE, "participant",
                h.om.readTree("{\"group_id\":1}"), null, null, null);
        assertThatThrownBy(() -> coordinator.handle(p, ChangeSource.REPLICA, "sheet"))
                .hasMessageContaining("unsupported_entity_type");
    }

    @Test
    void eventsFollowCommittedWritesOnly() {
        Post x = coordinator.create(draft(1, "X"), ChangeSource.REPLICA, "sheet");
        coordinator.update(x.postId(), 1L, PostPatch.status(PostStatus.RECORDING), ChangeSource.API, "api");

        assertThatThrownBy(() -> coordinator.update(x.postId(), 1L, PostPatch.EMPTY, ChangeSource.API, "api"))
                .isInstanceOf(VersionConflictException.class);

        assertThat(h.events).extracting(PostChangedEvent::kind)
                .containsExactly(ChangeKind.CREATE, ChangeKind.UPDATE);
        assertThat(h.audit.query(x.postId(), "update", 10))
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.field()).isEqualTo("status");
                    assertThat(a.oldValue()).isEqualTo("planned");
                    assertThat(a.newValue()).isEqualTo("recording");
                    assertThat(a.actor()).isEqualTo("api");
                });
    }

    @Test
    void deleteAndRestoreRoundTripThroughTrash() {
        Post x = coordinator.create(draft(1, "X"), ChangeSource.REPLICA, "sheet");

        coordinator.delete(x.postId(), 1L, ChangeSource.API, "ops");
        assertThat(h.posts.listActive()).isEmpty();
        assertThat(h.posts.listTrash()).singleElement().satisfies(t -> {
            assertThat(t.deletedAt()).isEqualTo(h.clock.instant());
            assertThat(t.deletedBy()).isEqualTo("ops");
        });

        Post restored = coordinator.restore(x.postId(), ChangeSource.API, "ops");
        assertThat(h.posts.listActive()).extracting(Post::postId).containsExactly(x.postId());
        assertThat(restored.version()).isEqualTo(3);
    }

    @Test
    void keepLocalForcesClientDataAndClearsConflict() throws Exception {
        Post x = coordinator.create(draft(1, "X"), ChangeSource.REPLICA, "sheet");
        coordinator.update(x.postId(), 1L, PostPatch.status(PostStatus.RECORDING), ChangeSource.API, "api");
        assertThatThrownBy(() -> coordinator.update(x.postId(), 1L, PostPatch.status(PostStatus.APPROVED),
                ChangeSource.REPLICA, "sheet")).isInstanceOf(VersionConflictException.class);

        ResolutionResult r = coordinator.resolve(x.postId(), ResolutionStrategy.KEEP_LOCAL,
                h.om.readTree("{\"status\":\"approved\"}"), ChangeSource.REPLICA, "sheet");

        assertThat(r.strategyApplied()).isEqualTo(ResolutionStrategy.KEEP_LOCAL);
        assertThat(r.post().status()).isEqualTo(PostStatus.APPROVED);
        assertThat(r.post().version()).isEqualTo(3);
        assertThat(h.syncStatus.find("post", x.postId()).orElseThrow().conflict()).isFalse();
    }

    @Test
    void mergeFallsBackToServerCopy() throws Exception {
        Post x = coordinator.create(draft(1, "X"), ChangeSource.REPLICA, "sheet");

        ResolutionResult r = coordinator.resolve(x.postId(), ResolutionStrategy.MERGE,
                h.om.readTree("{\"title\":\"ignored\"}"), ChangeSource.REPLICA, "sheet");

        assertThat(r.strategyRequested()).isEqualTo(ResolutionStrategy.MERGE);
        assertThat(r.strategyApplied()).isEqualTo(ResolutionStrategy.USE_SERVER);
        assertThat(r.post().title()).isEqualTo("X");
        assertThat(r.post().version()).isEqualTo(1);
    }

    @Test
    void createUsesTemplateDurationWhenNoneGiven() {
        h.referenceData.upsertPostType(new PostType("sermon", "Sermon", 900, null, "spoken", true),
                "admin", ChangeSource.API);

        Post p = coordinator.create(new NewPost(null, 1, null, "sermon", "Sunday", null, null, null, null,
                null, null, null, null, null), ChangeSource.API, "api");

        assertThat(p.durationSeconds()).isEqualTo(900);
    }

    @Test
    void versionLookupIsCachedAndInvalidatedOnWrite() {
        Post x = coordinator.create(draft(1, "X"), ChangeSource.REPLICA, "sheet");
        assertThat(coordinator.versionOf(x.postId()).version()).isEqualTo(1);

        coordinator.update(x.postId(), 1L, PostPatch.status(PostStatus.RECORDING), ChangeSource.API, "api");

        assertThat(coordinator.versionOf(x.postId()).version()).isEqualTo(2);
    }

    @Test
    void batchGetSplitsFoundAndMissing() {
        Post x = coordinator.create(draft(1, "X"), ChangeSource.REPLICA, "sheet");

        Map<String, Object> result = coordinator.batchGet(List.of(x.postId(), "P9:9"));

        assertThat(result.get("posts")).asList().hasSize(1);
        assertThat(result.get("missing")).asList().containsExactly("P9:9");
    }

    private SyncPayload payload(SyncAction action, String json, Long version) throws Exception {
        return new SyncPayload(ChangeSource.REPLICA, action, "post", h.om.readTree(json), version, null, null);
    }
}
