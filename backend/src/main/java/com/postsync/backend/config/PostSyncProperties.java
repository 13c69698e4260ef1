package com.postsync.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * All tunables under {@code postsync.*}. Passed to constructors; nothing reads
 * process-wide state.
 */
@Validated
@ConfigurationProperties(prefix = "postsync")
public record PostSyncProperties(
        @Valid @NotNull @DefaultValue Security security,
        @Valid @NotNull @DefaultValue RateLimit rateLimit,
        @Valid @NotNull @DefaultValue Cache cache,
        @Valid @NotNull @DefaultValue Audit audit,
        @Valid @NotNull @DefaultValue Notifications notifications,
        @Valid @NotNull @DefaultValue Trash trash,
        @Valid @NotNull @DefaultValue Groups groups,
        @Valid @NotNull @DefaultValue Backup backup
) {

    /** Blank secret = unprotected (kept for older replicas, logged as a warning). */
    public record Security(@DefaultValue("") String sharedSecret) {
        public boolean enforced() {
            return sharedSecret != null && !sharedSecret.isBlank();
        }
    }

    public record RateLimit(
            @Min(1) @DefaultValue("60") int requestsPerWindow,
            @NotNull @DefaultValue("60s") Duration window
    ) {}

    public record Cache(
            @NotNull @DefaultValue("300s") Duration ttl,
            @Min(1) @DefaultValue("1000") int maxEntries
    ) {}

    public record Audit(@Min(16) @DefaultValue("500") int maxValueLength) {}

    public record Notifications(
            @Min(1) @DefaultValue("3") int maxAttempts,
            @NotNull @DefaultValue("1s") Duration backoff,
            @NotNull @DefaultValue("5s") Duration timeout,
            @DefaultValue List<StaticSubscriber> subscribers
    ) {}

    public record StaticSubscriber(String clientId, String source, String url) {}

    public record Trash(
            @NotNull @DefaultValue("30d") Duration retention,
            @NotNull @DefaultValue("1h") Duration purgeInterval
    ) {}

    public record Groups(@Min(1) @DefaultValue("4") int count) {}

    public record Backup(@NotNull @DefaultValue("data/backups") String dir) {}
}
