package com.postsync.backend.domain;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Instant;
import java.util.List;

/**
 * One scheduled production segment.
 * - post_id: "P1:5" = group (program) 1, sequence 5. Never reused.
 * - version: optimistic-lock token, +1 on every accepted mutation.
 * - deleted_at/deleted_by: only set on records living in the trash.
 */
public record Post(
        String postId,
        @JsonAlias("program_nr") int groupId,
        int sortOrder,
        String typeKey,
        String title,
        int durationSeconds,
        String location,
        String notes,
        List<String> participantIds,
        String textAuthor,
        String composer,
        String recordingDay,    // day1 | day2 | day3
        String recordingTime,   // HH:mm[:ss]
        PostStatus status,
        long version,
        ChangeSource lastModifiedBy,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt,
        String deletedBy
) {
    public Post {
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
    }

    public boolean deleted() {
        return deletedAt != null;
    }

    public Post withVersion(long nextVersion, ChangeSource source, Instant now) {
        return new Post(postId, groupId, sortOrder, typeKey, title, durationSeconds, location, notes,
                participantIds, textAuthor, composer, recordingDay, recordingTime, status,
                nextVersion, source, createdAt, now, deletedAt, deletedBy);
    }

    public Post asDeleted(Instant at, String by) {
        return new Post(postId, groupId, sortOrder, typeKey, title, durationSeconds, location, notes,
                participantIds, textAuthor, composer, recordingDay, recordingTime, status,
                version, lastModifiedBy, createdAt, updatedAt, at, by);
    }

    public Post asRestored() {
        return new Post(postId, groupId, sortOrder, typeKey, title, durationSeconds, location, notes,
                participantIds, textAuthor, composer, recordingDay, recordingTime, status,
                version, lastModifiedBy, createdAt, updatedAt, null, null);
    }
}
