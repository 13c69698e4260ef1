package com.postsync.backend.service.cache;

import com.postsync.backend.config.PostSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Read-through front for {@link CacheClient}. A broken cache only costs a reload: every
 * cache failure is logged and the value comes straight from the loader.
 */
@Service
public class ReadThroughCache {

    public static final String POST_TYPES = "post-types:all";
    public static final String PARTICIPANTS = "participants:all";

    private static final Logger log = LoggerFactory.getLogger(ReadThroughCache.class);

    private final CacheClient client;
    private final Duration ttl;
    // bumped by every invalidation; a load that straddles one is not stored
    private final AtomicLong generation = new AtomicLong();

    public ReadThroughCache(CacheClient client, PostSyncProperties props) {
        this.client = client;
        this.ttl = props.cache().ttl();
    }

    public static String postVersionKey(String postId) {
        return "post-version:" + postId;
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key, Supplier<T> loader) {
        try {
            Optional<Object> hit = client.get(key);
            if (hit.isPresent()) return (T) hit.get();
        } catch (RuntimeException e) {
            log.warn("cache read failed for {}: {}", key, e.toString());
        }

        long seen = generation.get();
        T value = loader.get();
        if (generation.get() != seen) return value;
        try {
            client.put(key, value, ttl);
            if (generation.get() != seen) client.evict(key);
        } catch (RuntimeException e) {
            log.warn("cache store failed for {}, serving uncached: {}", key, e.toString());
        }
        return value;
    }

    public void invalidate(String key) {
        generation.incrementAndGet();
        try {
            client.evict(key);
        } catch (RuntimeException e) {
            log.warn("cache invalidation failed for {}: {}", key, e.toString());
        }
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        try {
            client.clear();
        } catch (RuntimeException e) {
            log.warn("cache clear failed: {}", e.toString());
        }
    }
}
