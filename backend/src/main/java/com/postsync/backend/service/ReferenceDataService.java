package com.postsync.backend.service;

import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.Participant;
import com.postsync.backend.domain.PostType;
import com.postsync.backend.repo.InMemoryStore;
import com.postsync.backend.service.cache.ReadThroughCache;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Post type templates and the participant directory. Both are read far more often than
 * written, so reads go through the cache and every write drops the cached list.
 */
@Service
public class ReferenceDataService {

    private final InMemoryStore store;
    private final ReadThroughCache cache;
    private final AuditLog audit;

    public ReferenceDataService(InMemoryStore store, ReadThroughCache cache, AuditLog audit) {
        this.store = store;
        this.cache = cache;
        this.audit = audit;
    }

    public List<PostType> listPostTypes() {
        return cache.get(ReadThroughCache.POST_TYPES, () -> store.postTypes.values().stream()
                .sorted(Comparator.comparing(PostType::typeKey))
                .toList());
    }

    public Optional<PostType> findPostType(String typeKey) {
        if (typeKey == null) return Optional.empty();
        return listPostTypes().stream().filter(t -> t.typeKey().equals(typeKey)).findFirst();
    }

    public PostType upsertPostType(PostType type, String actor, ChangeSource source) {
        if (type == null || type.typeKey() == null || type.typeKey().isBlank()) {
            throw new ValidationException("type_key_required");
        }
        if (type.displayName() == null || type.displayName().isBlank()) {
            throw new ValidationException("display_name_required");
        }
        if (type.defaultDurationSeconds() < 0) throw new ValidationException("default_duration_negative");

        PostType prev = store.postTypes.put(type.typeKey(), type);
        cache.invalidate(ReadThroughCache.POST_TYPES);
        audit.record(actor, prev == null ? "create" : "update", "post_type", type.typeKey(), prev, type, source);
        return type;
    }

    public List<Participant> listParticipants() {
        return cache.get(ReadThroughCache.PARTICIPANTS, () -> store.participants.values().stream()
                .sorted(Comparator.comparing(Participant::participantId))
                .toList());
    }

    public Participant upsertParticipant(Participant p, String actor, ChangeSource source) {
        if (p == null || p.participantId() == null || p.participantId().isBlank()) {
            throw new ValidationException("participant_id_required");
        }
        if (p.name() == null || p.name().isBlank()) throw new ValidationException("name_required");
        Participant normalized = new Participant(p.participantId(), p.name().trim(), p.roles(), p.contact(),
                p.kind() != null ? p.kind() : "participant");

        Participant prev = store.participants.put(normalized.participantId(), normalized);
        cache.invalidate(ReadThroughCache.PARTICIPANTS);
        audit.record(actor, prev == null ? "create" : "update", "participant", normalized.participantId(),
                prev, normalized, source);
        return normalized;
    }

    public void replaceAll(Collection<PostType> types, Collection<Participant> people) {
        store.postTypes.clear();
        store.participants.clear();
        if (types != null) types.forEach(t -> store.postTypes.put(t.typeKey(), t));
        if (people != null) people.forEach(p -> store.participants.put(p.participantId(), p));
        cache.invalidate(ReadThroughCache.POST_TYPES);
        cache.invalidate(ReadThroughCache.PARTICIPANTS);
    }
}
