package com.postsync.backend.api;

import com.postsync.backend.service.AuditLog;
import com.postsync.backend.service.SyncStatusTracker;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Read side of the audit trail and the per-entity sync bookkeeping.
 */
@RestController
@RequestMapping("/api")
public class AuditController {

    private final AuditLog audit;
    private final SyncStatusTracker syncStatus;

    public AuditController(AuditLog audit, SyncStatusTracker syncStatus) {
        this.audit = audit;
        this.syncStatus = syncStatus;
    }

    @GetMapping("/audit")
    public Map<String, Object> audit(@RequestParam(name = "entity_id", required = false) String entityId,
                                     @RequestParam(required = false) String action,
                                     @RequestParam(defaultValue = "100") int limit) {
        return Map.of("success", true, "entries", audit.query(entityId, action, limit));
    }

    @GetMapping("/sync-status")
    public Map<String, Object> syncStatus(@RequestParam(name = "entity_type", required = false) String entityType,
                                          @RequestParam(name = "entity_id", required = false) String entityId,
                                          @RequestParam(name = "conflicts_only", required = false) Boolean conflictsOnly) {
        if (entityType != null && entityId != null) {
            return syncStatus.find(entityType, entityId)
                    .<Map<String, Object>>map(s -> Map.of("success", true, "status", s))
                    .orElseThrow(() -> new NoSuchElementException("sync_status_not_found: " + entityId));
        }
        return Map.of("success", true, "statuses", syncStatus.list(entityType, conflictsOnly));
    }
}
