package com.postsync.backend.service;

import com.postsync.backend.config.PostSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Hard-deletes trashed posts once they are older than the retention window.
 */
@Component
public class TrashPurger {

    private static final Logger log = LoggerFactory.getLogger(TrashPurger.class);

    private final SyncCoordinator coordinator;
    private final Clock clock;
    private final Duration retention;

    public TrashPurger(SyncCoordinator coordinator, Clock clock, PostSyncProperties props) {
        this.coordinator = coordinator;
        this.clock = clock;
        this.retention = props.trash().retention();
    }

    @Scheduled(initialDelayString = "${postsync.trash.purge-interval:PT1H}",
            fixedDelayString = "${postsync.trash.purge-interval:PT1H}")
    public void purgeExpired() {
        try {
            int n = coordinator.purgeTrash(clock.instant().minus(retention));
            if (n > 0) log.info("purged {} trashed posts older than {}", n, retention);
        } catch (RuntimeException e) {
            log.error("trash purge failed", e);
        }
    }
}
