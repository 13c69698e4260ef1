package com.postsync.backend.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.postsync.backend.config.PostSyncProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Caffeine-backed {@link CacheClient}. Expiry follows the injected {@link Clock}; the
 * size bound evicts instead of refusing writes.
 */
@Component
public class InMemoryCacheClient implements CacheClient {

    private final Cache<String, Object> cache;

    public InMemoryCacheClient(Clock clock, PostSyncProperties props) {
        Duration defaultTtl = props.cache().ttl();
        this.cache = Caffeine.newBuilder()
                .maximumSize(props.cache().maxEntries())
                .expireAfter(new Expiry<String, Object>() {
                    @Override
                    public long expireAfterCreate(String key, Object value, long currentTime) {
                        return defaultTtl.toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Object value, long currentTime, long currentDuration) {
                        return defaultTtl.toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Object value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .build();
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    @Override
    public Optional<Object> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        if (value == null) return;
        cache.policy().expireVariably()
                .orElseThrow(() -> new IllegalStateException("cache built without variable expiry"))
                .put(key, value, ttl);
    }

    @Override
    public void evict(String key) {
        cache.invalidate(key);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
