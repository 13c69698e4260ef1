package com.postsync.backend.domain;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of every table; the unit of manual backup and disaster recovery.
 */
public record ExportDocument(
        int formatVersion,
        Instant exportedAt,
        String reason,
        List<Post> posts,
        List<Post> trash,
        List<AuditEntry> audit,
        List<SyncStatus> syncStatus,
        List<PostType> postTypes,
        List<Participant> participants,
        List<TimecodeEntry> timecodes
) {
    public static final int FORMAT_VERSION = 1;
}
