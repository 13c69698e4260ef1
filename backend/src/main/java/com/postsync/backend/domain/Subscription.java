package com.postsync.backend.domain;

import java.time.Instant;

/**
 * A replica that wants to be told about changes it did not make itself.
 */
public record Subscription(
        String clientId,
        ChangeSource source,
        String url,
        Instant registeredAt
) {}
