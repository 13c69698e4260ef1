package com.postsync.backend.service;

import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.ExportDocument;
import com.postsync.backend.service.cache.ReadThroughCache;
import com.postsync.backend.service.storage.BackupStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full export and restore. A restore always writes a safety export of the current state
 * first; if that write fails nothing is replaced.
 */
@Service
public class BackupService {

    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    private final PostStore posts;
    private final AuditLog audit;
    private final SyncStatusTracker syncStatus;
    private final ReferenceDataService referenceData;
    private final TimecodeService timecodes;
    private final ReadThroughCache cache;
    private final BackupStore backups;
    private final Clock clock;

    public BackupService(PostStore posts, AuditLog audit, SyncStatusTracker syncStatus,
                         ReferenceDataService referenceData, TimecodeService timecodes,
                         ReadThroughCache cache, BackupStore backups, Clock clock) {
        this.posts = posts;
        this.audit = audit;
        this.syncStatus = syncStatus;
        this.referenceData = referenceData;
        this.timecodes = timecodes;
        this.cache = cache;
        this.backups = backups;
        this.clock = clock;
    }

    public ExportDocument export(String reason) {
        PostStore.Snapshot snap = posts.snapshot();
        return new ExportDocument(
                ExportDocument.FORMAT_VERSION,
                clock.instant(),
                reason,
                snap.active(),
                snap.trash(),
                audit.all(),
                syncStatus.all(),
                referenceData.listPostTypes(),
                referenceData.listParticipants(),
                timecodes.all()
        );
    }

    public String saveExport(String reason) {
        return backups.write("export", export(reason));
    }

    public Map<String, Object> restore(ExportDocument doc, String actor) {
        if (doc == null || doc.posts() == null) throw new ValidationException("export_document_required");
        if (doc.formatVersion() > ExportDocument.FORMAT_VERSION) {
            throw new ValidationException("unsupported_format_version: " + doc.formatVersion());
        }

        String safety = backups.write("pre-restore", export("pre-restore"));
        log.info("safety export {} written before restore by {}", safety, actor);

        PostStore.Snapshot restored = posts.replaceAll(doc.posts(), doc.trash());
        audit.replaceAll(doc.audit() != null ? doc.audit() : List.of());
        syncStatus.replaceAll(doc.syncStatus());
        referenceData.replaceAll(doc.postTypes(), doc.participants());
        timecodes.replaceAll(doc.timecodes());
        cache.invalidateAll();

        audit.record(actor, "import", "store", "all", safety,
                "posts=" + restored.active().size() + " trash=" + restored.trash().size(), ChangeSource.SYSTEM);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("safety_export", safety);
        out.put("posts", restored.active().size());
        out.put("trash", restored.trash().size());
        return out;
    }

    public Map<String, Object> restoreFromFile(String fileName, String actor) {
        return restore(backups.read(fileName), actor);
    }

    public List<String> listBackups() {
        return backups.list();
    }
}
