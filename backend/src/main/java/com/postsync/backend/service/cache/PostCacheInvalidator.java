package com.postsync.backend.service.cache;

import com.postsync.backend.service.PostChangedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
public class PostCacheInvalidator {

    private final ReadThroughCache cache;

    public PostCacheInvalidator(ReadThroughCache cache) {
        this.cache = cache;
    }

    @Order(2)
    @EventListener
    public void onPostChanged(PostChangedEvent event) {
        cache.invalidate(ReadThroughCache.postVersionKey(event.postId()));
    }
}
