package com.postsync.backend.service.notify;

/**
 * One outbound push. Implementations throw on transport failure or a non-2xx answer.
 */
public interface WebhookClient {

    void deliver(String url, String jsonBody);
}
