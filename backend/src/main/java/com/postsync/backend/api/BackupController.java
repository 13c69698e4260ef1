package com.postsync.backend.api;

import com.postsync.backend.config.RequestClients;
import com.postsync.backend.domain.ExportDocument;
import com.postsync.backend.service.BackupService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Full-state export and import. Import always writes a safety export first.
 */
@RestController
@RequestMapping("/api")
public class BackupController {

    private final BackupService backups;

    public BackupController(BackupService backups) {
        this.backups = backups;
    }

    @GetMapping("/export")
    public ExportDocument export(@RequestParam(defaultValue = "manual") String reason) {
        return backups.export(reason);
    }

    @PostMapping("/import")
    public Map<String, Object> importAll(HttpServletRequest req,
                                         @RequestParam(required = false) String backup,
                                         @RequestBody(required = false) ExportDocument body) {
        String actor = RequestClients.clientId(req);
        Map<String, Object> result = backup != null && !backup.isBlank()
                ? backups.restoreFromFile(backup, actor)
                : backups.restore(body, actor);
        return Map.of("success", true, "result", result);
    }

    @GetMapping("/backups")
    public Map<String, Object> list() {
        return Map.of("success", true, "backups", backups.listBackups());
    }

    @PostMapping("/backups")
    public Map<String, Object> save(@RequestParam(defaultValue = "manual") String reason) {
        return Map.of("success", true, "file", backups.saveExport(reason));
    }
}
