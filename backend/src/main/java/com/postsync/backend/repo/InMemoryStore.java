package com.postsync.backend.repo;

import com.postsync.backend.domain.*;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide tables. Only the service layer touches these; controllers never do.
 */
@Component
public class InMemoryStore {
    public final ConcurrentHashMap<String, Post> activePosts = new ConcurrentHashMap<>();
    public final ConcurrentHashMap<String, Post> trash = new ConcurrentHashMap<>();

    // bookkeeping that must outlive any single post
    public final Set<String> issuedIds = ConcurrentHashMap.newKeySet();
    public final ConcurrentHashMap<String, Long> versionHighWater = new ConcurrentHashMap<>();
    public final ConcurrentHashMap<String, Long> insertionOrder = new ConcurrentHashMap<>();
    public final AtomicLong insertionSeq = new AtomicLong();
    public final ConcurrentHashMap<Integer, AtomicInteger> groupSequences = new ConcurrentHashMap<>();

    public final ConcurrentLinkedDeque<AuditEntry> audit = new ConcurrentLinkedDeque<>();
    public final ConcurrentHashMap<String, SyncStatus> syncStatus = new ConcurrentHashMap<>();

    public final ConcurrentHashMap<String, PostType> postTypes = new ConcurrentHashMap<>();
    public final ConcurrentHashMap<String, Participant> participants = new ConcurrentHashMap<>();
    public final CopyOnWriteArrayList<TimecodeEntry> timecodes = new CopyOnWriteArrayList<>();

    public final ConcurrentHashMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();
}
