package com.postsync.backend.api;

import com.postsync.backend.config.RequestClients;
import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.service.PostStore;
import com.postsync.backend.service.SyncCoordinator;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/trash")
public class TrashController {

    private final PostStore posts;
    private final SyncCoordinator coordinator;

    public TrashController(PostStore posts, SyncCoordinator coordinator) {
        this.posts = posts;
        this.coordinator = coordinator;
    }

    @GetMapping
    public Map<String, Object> list() {
        return Map.of("success", true, "posts", posts.listTrash());
    }

    @PostMapping("/restore")
    public Map<String, Object> restore(HttpServletRequest req, @RequestParam String id) {
        return Map.of("success", true, "post",
                coordinator.restore(id, ChangeSource.API, RequestClients.clientId(req)));
    }

    @DeleteMapping
    public Map<String, Object> purge(HttpServletRequest req, @RequestParam String id) {
        coordinator.purge(id, ChangeSource.API, RequestClients.clientId(req));
        return Map.of("success", true, "post_id", id);
    }
}
