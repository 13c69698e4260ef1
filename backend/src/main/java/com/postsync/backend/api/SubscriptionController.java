package com.postsync.backend.api;

import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.service.notify.SubscriptionRegistry;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/subscriptions")
public class SubscriptionController {

    private final SubscriptionRegistry registry;

    public SubscriptionController(SubscriptionRegistry registry) {
        this.registry = registry;
    }

    public record SubscribeReq(String clientId, String source, String url) {}

    @GetMapping
    public Map<String, Object> list() {
        return Map.of("success", true, "subscriptions", registry.list());
    }

    @PostMapping
    public Map<String, Object> subscribe(@RequestBody SubscribeReq body) {
        if (body == null) throw new IllegalArgumentException("body_required");
        ChangeSource source = body.source() == null ? null : ChangeSource.fromWire(body.source());
        return Map.of("success", true, "subscription", registry.register(body.clientId(), source, body.url()));
    }

    @DeleteMapping
    public Map<String, Object> unsubscribe(@RequestParam(name = "client_id") String clientId) {
        if (!registry.remove(clientId)) throw new NoSuchElementException("subscription_not_found: " + clientId);
        return Map.of("success", true, "client_id", clientId);
    }
}
