package com.postsync.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.postsync.backend.config.PostSyncProperties;
import com.postsync.backend.domain.AuditEntry;
import com.postsync.backend.domain.ChangeKind;
import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.Post;
import com.postsync.backend.domain.PostChange;
import com.postsync.backend.domain.PostPatch;
import com.postsync.backend.domain.PostStatus;
import com.postsync.backend.repo.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only trail of every mutation. Recording is best effort: a failure here is
 * logged and swallowed, the mutation it describes has already been committed.
 */
@Service
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);
    private static final int MAX_QUERY_LIMIT = 500;

    private final InMemoryStore store;
    private final ObjectMapper om;
    private final Clock clock;
    private final int maxValueLength;

    public AuditLog(InMemoryStore store, ObjectMapper om, Clock clock, PostSyncProperties props) {
        this.store = store;
        this.om = om;
        this.clock = clock;
        this.maxValueLength = props.audit().maxValueLength();
    }

    public void record(AuditEntry entry) {
        try {
            AuditEntry bounded = new AuditEntry(
                    entry.id() != null ? entry.id() : UUID.randomUUID().toString(),
                    entry.timestamp() != null ? entry.timestamp() : clock.instant(),
                    entry.actor(),
                    entry.action(),
                    entry.entityType(),
                    entry.entityId(),
                    entry.field(),
                    truncate(entry.oldValue()),
                    truncate(entry.newValue()),
                    entry.source() != null ? entry.source() : ChangeSource.SYSTEM
            );
            store.audit.addFirst(bounded); // newest first
        } catch (RuntimeException e) {
            log.error("audit write failed for {} {}", entry.entityType(), entry.entityId(), e);
        }
    }

    public void record(String actor, String action, String entityType, String entityId,
                       Object oldValue, Object newValue, ChangeSource source) {
        try {
            record(new AuditEntry(null, null, actor, action, entityType, entityId, null,
                    render(oldValue), render(newValue), source));
        } catch (RuntimeException e) {
            log.error("audit of {} {} {} failed", action, entityType, entityId, e);
        }
    }

    @Order(1)
    @EventListener
    public void onPostChanged(PostChangedEvent event) {
        try {
            PostChange c = event.change();
            String action = event.kind().wire();
            if (event.kind() == ChangeKind.UPDATE || event.kind() == ChangeKind.RENUMBER) {
                recordFieldChanges(event, action, c.before(), c.after());
            } else {
                record(event.actor(), action, "post", c.postId(), c.before(), c.after(), event.source());
            }
        } catch (RuntimeException e) {
            log.error("audit of {} {} failed", event.kind(), event.postId(), e);
        }
    }

    private void recordFieldChanges(PostChangedEvent event, String action, Post before, Post after) {
        Map<String, Object[]> diff = PostPatch.diff(before, after);
        if (diff.isEmpty()) {
            // forced write with an empty patch: only the version moved
            record(new AuditEntry(null, null, event.actor(), action, "post", after.postId(), "version",
                    String.valueOf(before.version()), String.valueOf(after.version()), event.source()));
            return;
        }
        diff.forEach((field, values) -> record(new AuditEntry(null, null, event.actor(), action, "post",
                after.postId(), field, render(values[0]), render(values[1]), event.source())));
    }

    public List<AuditEntry> query(String entityId, String action, int limit) {
        return store.audit.stream()
                .filter(a -> entityId == null || entityId.isBlank() || entityId.equals(a.entityId()))
                .filter(a -> action == null || action.isBlank() || action.equalsIgnoreCase(a.action()))
                .limit(Math.max(1, Math.min(limit, MAX_QUERY_LIMIT)))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> all() {
        return List.copyOf(store.audit);
    }

    public void replaceAll(Collection<AuditEntry> entries) {
        store.audit.clear();
        if (entries != null) store.audit.addAll(entries);
    }

    String render(Object value) {
        if (value == null) return null;
        if (value instanceof String s) return s;
        if (value instanceof PostStatus s) return s.wire();
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private String truncate(String value) {
        if (value == null || value.length() <= maxValueLength) return value;
        return value.substring(0, maxValueLength);
    }
}
