package com.postsync.backend.domain;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Partial update: null fields are left untouched. post_id and version travel next to
 * the patch, never inside it.
 */
public record PostPatch(
        @JsonAlias("program_nr") Integer groupId,
        Integer sortOrder,
        String typeKey,
        String title,
        Integer durationSeconds,
        String location,
        String notes,
        List<String> participantIds,
        String textAuthor,
        String composer,
        String recordingDay,
        String recordingTime,
        PostStatus status
) {
    public static final PostPatch EMPTY =
            new PostPatch(null, null, null, null, null, null, null, null, null, null, null, null, null);

    public static PostPatch status(PostStatus status) {
        return new PostPatch(null, null, null, null, null, null, null, null, null, null, null, null, status);
    }

    public static PostPatch statusAndNotes(PostStatus status, String notes) {
        return new PostPatch(null, null, null, null, null, null, notes, null, null, null, null, null, status);
    }

    public static PostPatch sortOrder(int sortOrder) {
        return new PostPatch(null, sortOrder, null, null, null, null, null, null, null, null, null, null, null);
    }

    /** Applies the patch; version, timestamps and source are stamped by the store. */
    public Post applyTo(Post p, long nextVersion, ChangeSource source, Instant now) {
        return new Post(
                p.postId(),
                groupId != null ? groupId : p.groupId(),
                sortOrder != null ? sortOrder : p.sortOrder(),
                typeKey != null ? typeKey : p.typeKey(),
                title != null ? title : p.title(),
                durationSeconds != null ? durationSeconds : p.durationSeconds(),
                location != null ? location : p.location(),
                notes != null ? notes : p.notes(),
                participantIds != null ? participantIds : p.participantIds(),
                textAuthor != null ? textAuthor : p.textAuthor(),
                composer != null ? composer : p.composer(),
                recordingDay != null ? recordingDay : p.recordingDay(),
                recordingTime != null ? recordingTime : p.recordingTime(),
                status != null ? status : p.status(),
                nextVersion,
                source,
                p.createdAt(),
                now,
                null,
                null
        );
    }

    /** Field name (wire form) to {old, new} for every user-visible field that differs. */
    public static Map<String, Object[]> diff(Post before, Post after) {
        Map<String, Object[]> out = new LinkedHashMap<>();
        put(out, "group_id", before.groupId(), after.groupId());
        put(out, "sort_order", before.sortOrder(), after.sortOrder());
        put(out, "type_key", before.typeKey(), after.typeKey());
        put(out, "title", before.title(), after.title());
        put(out, "duration_seconds", before.durationSeconds(), after.durationSeconds());
        put(out, "location", before.location(), after.location());
        put(out, "notes", before.notes(), after.notes());
        put(out, "participant_ids", before.participantIds(), after.participantIds());
        put(out, "text_author", before.textAuthor(), after.textAuthor());
        put(out, "composer", before.composer(), after.composer());
        put(out, "recording_day", before.recordingDay(), after.recordingDay());
        put(out, "recording_time", before.recordingTime(), after.recordingTime());
        put(out, "status", before.status(), after.status());
        return out;
    }

    private static void put(Map<String, Object[]> out, String field, Object oldValue, Object newValue) {
        if (!Objects.equals(oldValue, newValue)) {
            out.put(field, new Object[]{oldValue, newValue});
        }
    }
}
