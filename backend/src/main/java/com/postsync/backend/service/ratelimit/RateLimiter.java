package com.postsync.backend.service.ratelimit;

import com.postsync.backend.config.PostSyncProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Fixed-window request limit per client id.
 */
@Service
public class RateLimiter {

    private final CounterStore counters;
    private final Clock clock;
    private final int limit;
    private final Duration window;

    public RateLimiter(CounterStore counters, Clock clock, PostSyncProperties props) {
        this.counters = counters;
        this.clock = clock;
        this.limit = props.rateLimit().requestsPerWindow();
        this.window = props.rateLimit().window();
    }

    /**
     * Counts one request for {@code clientId}.
     *
     * @throws RateLimitedException carrying the seconds left in the current window
     */
    public void acquire(String clientId) {
        CounterStore.Window w = counters.incrementIfBelow("rate:" + clientId, limit, window);
        if (w.accepted()) return;
        long millisLeft = Duration.between(clock.instant(), w.expiresAt()).toMillis();
        long retryAfter = Math.max(1, (millisLeft + 999) / 1000);
        throw new RateLimitedException(clientId, retryAfter);
    }

    public int limit() {
        return limit;
    }
}
