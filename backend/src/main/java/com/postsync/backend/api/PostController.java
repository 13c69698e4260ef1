package com.postsync.backend.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.postsync.backend.config.RequestClients;
import com.postsync.backend.domain.*;
import com.postsync.backend.service.ScheduleService;
import com.postsync.backend.service.SyncCoordinator;
import com.postsync.backend.service.PostStore;
import com.postsync.backend.service.TimecodeService;
import com.postsync.backend.service.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Gateway for control systems and other third parties. Writes are tagged as "api".
 */
@RestController
@RequestMapping("/api")
public class PostController {

    private final SyncCoordinator coordinator;
    private final PostStore posts;
    private final ScheduleService schedule;
    private final TimecodeService timecodes;
    private final ObjectMapper om;

    public PostController(SyncCoordinator coordinator, PostStore posts, ScheduleService schedule,
                          TimecodeService timecodes, ObjectMapper om) {
        this.coordinator = coordinator;
        this.posts = posts;
        this.schedule = schedule;
        this.timecodes = timecodes;
        this.om = om;
    }

    public record StatusReq(String status, Long version) {}
    public record BatchGetReq(List<String> ids) {}
    public record BatchUpdateReq(List<JsonNode> updates) {}

    @GetMapping("/posts")
    public Map<String, Object> list(@RequestParam(required = false) Integer program,
                                    @RequestParam(required = false) String status) {
        PostStatus s = status == null || status.isBlank() ? null : PostStatus.fromWire(status);
        return Map.of("success", true, "posts", schedule.listActive(program, s));
    }

    @PostMapping("/posts")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> create(HttpServletRequest req, @RequestBody NewPost body) {
        return Map.of("success", true, "post", coordinator.create(body, ChangeSource.API, RequestClients.clientId(req)));
    }

    @GetMapping("/post")
    public Map<String, Object> get(@RequestParam String id) {
        return Map.of("success", true, "post", posts.getById(id));
    }

    @PutMapping("/post")
    public Map<String, Object> update(HttpServletRequest req, @RequestParam String id, @RequestBody JsonNode body) {
        if (body == null || !body.isObject()) throw new ValidationException("body_required");
        Long version = SyncCoordinator.versionIn(body);
        PostPatch patch = om.convertValue(body, PostPatch.class);
        Post updated = coordinator.update(id, version, patch, ChangeSource.API, RequestClients.clientId(req));
        return Map.of("success", true, "post", updated);
    }

    @DeleteMapping("/post")
    public Map<String, Object> delete(HttpServletRequest req, @RequestParam String id,
                                      @RequestParam(required = false) Long version) {
        Post tomb = coordinator.delete(id, version, ChangeSource.API, RequestClients.clientId(req));
        return Map.of("success", true, "post", tomb);
    }

    @GetMapping("/post/version")
    public Map<String, Object> version(@RequestParam String id) {
        return Map.of("success", true, "version", coordinator.versionOf(id));
    }

    @PostMapping("/post/status")
    public Map<String, Object> changeStatus(HttpServletRequest req, @RequestParam String id, @RequestBody StatusReq body) {
        if (body == null || body.status() == null) throw new ValidationException("status_required");
        Post updated = coordinator.changeStatus(id, PostStatus.fromWire(body.status()), body.version(),
                ChangeSource.API, RequestClients.clientId(req));
        return Map.of("success", true, "post", updated);
    }

    @PostMapping("/posts/batch-get")
    public Map<String, Object> batchGet(@RequestBody BatchGetReq body) {
        Map<String, Object> result = coordinator.batchGet(body == null ? null : body.ids());
        return Map.of("success", true, "posts", result.get("posts"), "missing", result.get("missing"));
    }

    @PostMapping("/posts/batch-update")
    public Map<String, Object> batchUpdate(HttpServletRequest req, @RequestBody BatchUpdateReq body) {
        BatchUpdateResult result = coordinator.batchUpdate(body == null ? null : body.updates(),
                ChangeSource.API, RequestClients.clientId(req));
        return Map.of("success", true, "results", result);
    }

    @PostMapping("/posts/renumber")
    public Map<String, Object> renumber(HttpServletRequest req, @RequestParam int program) {
        return Map.of("success", true, "posts",
                coordinator.renumber(program, ChangeSource.API, RequestClients.clientId(req)));
    }

    @GetMapping("/schedule")
    public Map<String, Object> schedule(@RequestParam(required = false) String day) {
        return Map.of("success", true, "schedule", schedule.schedule(day));
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        return Map.of("success", true, "stats", schedule.stats());
    }

    @GetMapping("/timecodes")
    public Map<String, Object> timecodes(@RequestParam(name = "post_id", required = false) String postId) {
        return Map.of("success", true, "timecodes", timecodes.list(postId));
    }
}
