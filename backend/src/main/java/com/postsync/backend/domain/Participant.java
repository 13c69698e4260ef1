package com.postsync.backend.domain;

import java.util.List;

public record Participant(
        String participantId,   // "P001"
        String name,
        List<String> roles,
        String contact,
        String kind             // participant | team | composer | text_author
) {
    public Participant {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
