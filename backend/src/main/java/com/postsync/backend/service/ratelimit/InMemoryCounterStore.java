package com.postsync.backend.service.ratelimit;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryCounterStore implements CounterStore {

    private record Counter(int count, Instant expiresAt) {}

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Window incrementIfBelow(String key, int limit, Duration window) {
        Instant now = clock.instant();
        boolean[] accepted = new boolean[1];
        Counter c = counters.compute(key, (k, cur) -> {
            if (cur == null || !now.isBefore(cur.expiresAt())) {
                accepted[0] = true;
                return new Counter(1, now.plus(window));
            }
            if (cur.count() >= limit) {
                accepted[0] = false;
                return cur;
            }
            accepted[0] = true;
            return new Counter(cur.count() + 1, cur.expiresAt());
        });
        if (counters.size() > 10_000) sweep(now);
        return new Window(accepted[0], c.count(), c.expiresAt());
    }

    private void sweep(Instant now) {
        counters.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
    }
}
