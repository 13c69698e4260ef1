package com.postsync.backend.api;

import com.postsync.backend.config.PostSyncProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final PostSyncProperties props;

    public HealthController(PostSyncProperties props) {
        this.props = props;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "secret_enforced", props.security().enforced()
        );
    }
}
