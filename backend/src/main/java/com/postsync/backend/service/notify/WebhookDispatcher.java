package com.postsync.backend.service.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.postsync.backend.config.PostSyncProperties;
import com.postsync.backend.domain.Post;
import com.postsync.backend.domain.Subscription;
import com.postsync.backend.service.PostChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes committed changes to subscribed replicas. Delivery runs off the request thread,
 * is retried a bounded number of times with linearly growing pauses and is then dropped;
 * the mutation itself is never affected.
 */
@Service
public class WebhookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    private final SubscriptionRegistry subscriptions;
    private final WebhookClient client;
    private final TaskExecutor executor;
    private final ObjectMapper om;
    private final int maxAttempts;
    private final Duration backoff;

    public WebhookDispatcher(SubscriptionRegistry subscriptions,
                             WebhookClient client,
                             @Qualifier("webhookExecutor") TaskExecutor executor,
                             ObjectMapper om,
                             PostSyncProperties props) {
        this.subscriptions = subscriptions;
        this.client = client;
        this.executor = executor;
        this.om = om;
        this.maxAttempts = props.notifications().maxAttempts();
        this.backoff = props.notifications().backoff();
    }

    @Order(4)
    @EventListener
    public void onPostChanged(PostChangedEvent event) {
        List<Subscription> targets = subscriptions.recipientsFor(event.source());
        if (targets.isEmpty()) return;

        String body;
        try {
            body = om.writeValueAsString(payload(event));
        } catch (JsonProcessingException e) {
            log.error("cannot serialize change of {} for webhooks", event.postId(), e);
            return;
        }
        for (Subscription sub : targets) {
            try {
                executor.execute(() -> deliver(sub, event.postId(), body));
            } catch (RuntimeException e) {
                log.warn("webhook to {} not scheduled: {}", sub.clientId(), e.toString());
            }
        }
    }

    /** @return true when one attempt succeeded */
    boolean deliver(Subscription sub, String postId, String body) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                client.deliver(sub.url(), body);
                log.debug("webhook {} -> {} delivered (attempt {})", postId, sub.clientId(), attempt);
                return true;
            } catch (RuntimeException e) {
                log.warn("webhook {} -> {} failed (attempt {}/{}): {}",
                        postId, sub.clientId(), attempt, maxAttempts, e.toString());
            }
            if (attempt < maxAttempts && !pause(backoff.multipliedBy(attempt))) {
                return false;
            }
        }
        log.warn("webhook {} -> {} dropped after {} attempts", postId, sub.clientId(), maxAttempts);
        return false;
    }

    private static boolean pause(Duration d) {
        if (d.isZero() || d.isNegative()) return true;
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Map<String, Object> payload(PostChangedEvent event) {
        Post current = event.change().after() != null ? event.change().after() : event.change().before();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("event", "post." + event.kind().wire());
        m.put("post_id", event.postId());
        m.put("version", event.change().version());
        m.put("source", event.source().wire());
        m.put("post", current);
        return m;
    }
}
