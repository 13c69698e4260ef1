package com.postsync.backend.api;

import com.postsync.backend.config.RequestClients;
import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.Participant;
import com.postsync.backend.domain.PostType;
import com.postsync.backend.service.ReferenceDataService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class ReferenceDataController {

    private final ReferenceDataService reference;

    public ReferenceDataController(ReferenceDataService reference) {
        this.reference = reference;
    }

    @GetMapping("/post-types")
    public Map<String, Object> postTypes() {
        return Map.of("success", true, "post_types", reference.listPostTypes());
    }

    @PostMapping("/post-types")
    public Map<String, Object> upsertPostType(HttpServletRequest req, @RequestBody PostType body) {
        return Map.of("success", true, "post_type",
                reference.upsertPostType(body, RequestClients.clientId(req), ChangeSource.API));
    }

    @GetMapping("/participants")
    public Map<String, Object> participants() {
        return Map.of("success", true, "participants", reference.listParticipants());
    }

    @PostMapping("/participants")
    public Map<String, Object> upsertParticipant(HttpServletRequest req, @RequestBody Participant body) {
        return Map.of("success", true, "participant",
                reference.upsertParticipant(body, RequestClients.clientId(req), ChangeSource.API));
    }
}
