package com.postsync.backend.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.postsync.backend.config.RequestClients;
import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.ControlSystemPayload;
import com.postsync.backend.domain.ResolutionStrategy;
import com.postsync.backend.domain.SyncPayload;
import com.postsync.backend.service.SyncCoordinator;
import com.postsync.backend.service.TimecodeService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound change feeds, one per kind of replica.
 */
@RestController
@RequestMapping("/sync")
public class SyncController {

    private final SyncCoordinator coordinator;
    private final TimecodeService timecodes;

    public SyncController(SyncCoordinator coordinator, TimecodeService timecodes) {
        this.coordinator = coordinator;
        this.timecodes = timecodes;
    }

    public record ResolveReq(String postId, ResolutionStrategy strategy, JsonNode data) {}

    @PostMapping("/from-replica")
    public Map<String, Object> fromReplica(HttpServletRequest req, @RequestBody SyncPayload payload) {
        Object data = coordinator.handle(payload, ChangeSource.REPLICA, RequestClients.clientId(req));
        return ok(data);
    }

    @PostMapping("/from-display-client")
    public Map<String, Object> fromDisplayClient(HttpServletRequest req, @RequestBody SyncPayload payload) {
        return ok(coordinator.handleDisplayClient(payload, RequestClients.clientId(req)));
    }

    @PostMapping("/from-control-system")
    public Map<String, Object> fromControlSystem(HttpServletRequest req, @RequestBody ControlSystemPayload payload) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.putAll(timecodes.handle(payload, RequestClients.clientId(req)));
        return out;
    }

    @PostMapping("/resolve")
    public Map<String, Object> resolve(HttpServletRequest req, @RequestBody ResolveReq body) {
        if (body == null) throw new IllegalArgumentException("body_required");
        return ok(coordinator.resolve(body.postId(), body.strategy(), body.data(),
                ChangeSource.REPLICA, RequestClients.clientId(req)));
    }

    private static Map<String, Object> ok(Object data) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put("data", data);
        return out;
    }
}
