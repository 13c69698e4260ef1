package com.postsync.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.postsync.backend.config.JacksonConfig;
import com.postsync.backend.config.PostSyncProperties;
import com.postsync.backend.domain.NewPost;
import com.postsync.backend.domain.PostStatus;
import com.postsync.backend.repo.InMemoryStore;
import com.postsync.backend.service.cache.CacheClient;
import com.postsync.backend.service.cache.InMemoryCacheClient;
import com.postsync.backend.service.cache.PostCacheInvalidator;
import com.postsync.backend.service.cache.ReadThroughCache;
import com.postsync.backend.service.storage.BackupStore;
import com.postsync.backend.support.MutableClock;
import com.postsync.backend.support.TestProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Hand-wired service graph. Events are delivered synchronously in listener order,
 * the same order the application context uses.
 */
class ServiceHarness {

    final MutableClock clock = MutableClock.at("2026-03-01T09:00:00Z");
    final ObjectMapper om = new JacksonConfig().objectMapper();
    final InMemoryStore store = new InMemoryStore();
    final PostSyncProperties props;
    final CacheClient cacheClient;
    final ReadThroughCache cache;
    final AuditLog audit;
    final SyncStatusTracker syncStatus;
    final ReferenceDataService referenceData;
    final InMemoryPostStore posts;
    final SyncCoordinator coordinator;
    final TimecodeService timecodes;
    final List<PostChangedEvent> events = new CopyOnWriteArrayList<>();

    ServiceHarness() {
        this(TestProperties.defaults());
    }

    ServiceHarness(PostSyncProperties props) {
        this(props, null);
    }

    ServiceHarness(PostSyncProperties props, CacheClient cacheClient) {
        this(props, cacheClient, null);
    }

    ServiceHarness(PostSyncProperties props, CacheClient cacheClient, ObjectMapper auditMapper) {
        this.props = props;
        this.cacheClient = cacheClient != null ? cacheClient : new InMemoryCacheClient(clock, props);
        this.cache = new ReadThroughCache(this.cacheClient, props);
        this.audit = new AuditLog(store, auditMapper != null ? auditMapper : om, clock, props);
        this.syncStatus = new SyncStatusTracker(store, clock);
        this.referenceData = new ReferenceDataService(store, cache, audit);
        this.posts = new InMemoryPostStore(store, clock, props);

        PostCacheInvalidator invalidator = new PostCacheInvalidator(cache);
        List<Consumer<PostChangedEvent>> listeners = new ArrayList<>();
        listeners.add(audit::onPostChanged);
        listeners.add(invalidator::onPostChanged);
        listeners.add(syncStatus::onPostChanged);
        listeners.add(events::add);

        this.coordinator = new SyncCoordinator(posts, syncStatus, referenceData, cache,
                event -> listeners.forEach(l -> l.accept((PostChangedEvent) event)), om);
        this.timecodes = new TimecodeService(store, coordinator, clock);
    }

    BackupService backups(String dir) {
        BackupStore files = new BackupStore(om, TestProperties.builder().backupDir(dir).build());
        return new BackupService(posts, audit, syncStatus, referenceData, timecodes, cache, files, clock);
    }

    static NewPost draft(int group, String title) {
        return new NewPost(null, group, null, null, title, null, null, null, null, null, null, null, null, null);
    }

    static NewPost draftWithId(String id, int group, String title) {
        return new NewPost(id, group, null, null, title, null, null, null, null, null, null, null, null, PostStatus.PLANNED);
    }
}
