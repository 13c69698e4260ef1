package com.postsync.backend.service.ratelimit;

public class RateLimitedException extends RuntimeException {

    private final String clientId;
    private final long retryAfterSeconds;

    public RateLimitedException(String clientId, long retryAfterSeconds) {
        super("rate_limited: " + clientId);
        this.clientId = clientId;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String clientId() {
        return clientId;
    }

    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }
}
