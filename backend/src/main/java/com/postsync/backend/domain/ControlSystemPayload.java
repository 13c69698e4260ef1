package com.postsync.backend.domain;

/**
 * Timecode push from a vision mixer / control surface.
 * action: tc_in | tc_out. Timecodes are HH:MM:SS:FF.
 */
public record ControlSystemPayload(
        String action,
        String postId,
        String tcIn,
        String tcOut,
        Integer clipNr,
        String operator,
        String apiKey
) {}
