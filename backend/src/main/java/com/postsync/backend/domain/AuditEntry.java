package com.postsync.backend.domain;

import java.time.Instant;

public record AuditEntry(
        String id,
        Instant timestamp,
        String actor,
        String action,      // create | update | delete | restore | purge | renumber | import | timecode
        String entityType,  // post | post_type | participant | store
        String entityId,
        String field,       // set only for field-level updates
        String oldValue,
        String newValue,
        ChangeSource source
) {}
