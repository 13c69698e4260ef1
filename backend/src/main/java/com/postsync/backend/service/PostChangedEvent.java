package com.postsync.backend.service;

import com.postsync.backend.domain.ChangeKind;
import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.PostChange;

/**
 * Published after a post mutation has been committed to the store. Listeners run the
 * secondary effects (audit, cache, sync status, webhooks) and must not throw.
 */
public record PostChangedEvent(
        ChangeKind kind,
        PostChange change,
        ChangeSource source,
        String actor
) {
    public String postId() {
        return change.postId();
    }
}
