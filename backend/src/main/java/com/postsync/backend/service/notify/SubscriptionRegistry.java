package com.postsync.backend.service.notify;

import com.postsync.backend.config.PostSyncProperties;
import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.Subscription;
import com.postsync.backend.repo.InMemoryStore;
import com.postsync.backend.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Service
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final InMemoryStore store;
    private final Clock clock;

    public SubscriptionRegistry(InMemoryStore store, Clock clock, PostSyncProperties props) {
        this.store = store;
        this.clock = clock;
        for (PostSyncProperties.StaticSubscriber s : props.notifications().subscribers()) {
            register(s.clientId(), ChangeSource.fromWire(s.source()), s.url());
            log.info("static webhook subscriber {} -> {}", s.clientId(), s.url());
        }
    }

    public Subscription register(String clientId, ChangeSource source, String url) {
        if (clientId == null || clientId.isBlank()) throw new ValidationException("client_id_required");
        if (source == null) throw new ValidationException("source_required");
        validateUrl(url);
        Subscription sub = new Subscription(clientId.trim(), source, url.trim(), clock.instant());
        store.subscriptions.put(sub.clientId(), sub);
        return sub;
    }

    public boolean remove(String clientId) {
        return clientId != null && store.subscriptions.remove(clientId) != null;
    }

    public List<Subscription> list() {
        return store.subscriptions.values().stream()
                .sorted(Comparator.comparing(Subscription::clientId))
                .toList();
    }

    /** Everyone except clients of the kind that produced the change. */
    public List<Subscription> recipientsFor(ChangeSource origin) {
        return list().stream().filter(s -> s.source() != origin).toList();
    }

    private static void validateUrl(String url) {
        if (url == null || url.isBlank()) throw new ValidationException("url_required");
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
                throw new ValidationException("invalid_url: " + url);
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid_url: " + url);
        }
    }
}
