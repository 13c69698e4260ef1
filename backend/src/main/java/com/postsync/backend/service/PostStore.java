package com.postsync.backend.service;

import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.NewPost;
import com.postsync.backend.domain.Post;
import com.postsync.backend.domain.PostChange;
import com.postsync.backend.domain.PostPatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative, versioned post storage.
 *
 * Every mutation that succeeds bumps {@code version} by exactly one. Version checks
 * happen atomically with the write, so of two writers holding the same version only
 * one gets through and the other receives {@link VersionConflictException}.
 * A {@code null} expected version is a forced write: no check, version still bumps.
 */
public interface PostStore {

    PostChange create(NewPost draft, ChangeSource source);

    PostChange update(String postId, Long expectedVersion, PostPatch patch, ChangeSource source);

    /** Moves the post into the trash. */
    PostChange softDelete(String postId, Long expectedVersion, String deletedBy, ChangeSource source);

    /** Removes the post from the active set or the trash without archiving it. */
    PostChange hardDelete(String postId);

    PostChange restore(String postId, ChangeSource source);

    Optional<Post> findById(String postId);

    Post getById(String postId);

    /** Looks in the trash as well when {@code includeDeleted} is set. */
    Post getById(String postId, boolean includeDeleted);

    boolean exists(String postId);

    boolean isTrashed(String postId);

    List<Post> listActive();

    List<Post> listByGroup(int groupId);

    List<Post> listTrash();

    /** Rewrites sort orders of a group to 10, 20, 30... Only moved posts change. */
    List<PostChange> renumber(int groupId, ChangeSource source);

    List<PostChange> purgeTrash(Instant deletedBefore);

    Snapshot snapshot();

    /**
     * Replaces every post. Versions of imported posts are lifted above anything already
     * issued for the same id so replicas never see a version go backwards.
     */
    Snapshot replaceAll(List<Post> active, List<Post> trashed);

    record Snapshot(List<Post> active, List<Post> trash) {}
}
