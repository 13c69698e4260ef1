package com.postsync.backend.domain;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * Create body. Only group_id is mandatory; post_id is assigned when absent.
 */
public record NewPost(
        String postId,
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
) {}
