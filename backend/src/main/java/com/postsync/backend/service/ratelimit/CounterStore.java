package com.postsync.backend.service.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Expiring counters. An entry lives for one window from its first increment; once it
 * expires the next increment starts a fresh window.
 */
public interface CounterStore {

    /**
     * Increments {@code key} unless it already reached {@code limit} in the current window.
     */
    Window incrementIfBelow(String key, int limit, Duration window);

    record Window(boolean accepted, int count, Instant expiresAt) {}
}
