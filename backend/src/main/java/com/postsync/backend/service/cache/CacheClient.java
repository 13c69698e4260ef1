package com.postsync.backend.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry expiry. Holds disposable copies only; any method may
 * fail and callers are expected to fall back to the source of truth.
 */
public interface CacheClient {

    Optional<Object> get(String key);

    void put(String key, Object value, Duration ttl);

    void evict(String key);

    void clear();
}
