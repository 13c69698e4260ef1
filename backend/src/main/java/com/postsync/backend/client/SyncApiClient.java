package com.postsync.backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.SyncPayload;
import com.postsync.backend.service.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Replica-side client for {@code /sync/*}. Transport failures, 5xx and 429 are retried
 * with linear backoff; a 409 is never retried and surfaces as
 * {@link VersionConflictException} so the caller can pick a resolution strategy.
 */
public class SyncApiClient {

    private static final Logger log = LoggerFactory.getLogger(SyncApiClient.class);

    private final RestClient restClient;
    private final ObjectMapper om;
    private final int maxAttempts;
    private final Duration backoff;

    public SyncApiClient(RestClient.Builder builder, String baseUrl, String apiKey, String clientId,
                         ObjectMapper om, int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        RestClient.Builder b = builder.baseUrl(baseUrl).defaultHeader("X-Client-Id", clientId);
        if (apiKey != null && !apiKey.isBlank()) b = b.defaultHeader("X-Api-Key", apiKey);
        this.restClient = b.build();
        this.om = om;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    /** @return the {@code data} member of the server's reply */
    public JsonNode push(SyncPayload payload) {
        return post("/sync/from-replica", payload).path("data");
    }

    public JsonNode resolve(String postId, String strategy, JsonNode data) {
        ResolveBody body = new ResolveBody(postId, strategy, data);
        return post("/sync/resolve", body).path("data");
    }

    public JsonNode version(String postId) {
        return send(() -> restClient.get()
                .uri(u -> u.path("/api/post/version").queryParam("id", postId).build())
                .retrieve()
                .body(String.class), "GET /api/post/version").path("version");
    }

    record ResolveBody(String postId, String strategy, JsonNode data) {}

    private JsonNode post(String path, Object body) {
        String json;
        try {
            json = om.writeValueAsString(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("cannot serialize request for " + path, e);
        }
        return send(() -> restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .body(json)
                .retrieve()
                .body(String.class), "POST " + path);
    }

    private JsonNode send(Call call, String what) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return parse(call.execute());
            } catch (RestClientResponseException e) {
                if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                    throw conflict(e.getResponseBodyAsString());
                }
                if (!retryable(e)) throw e;
                last = e;
            } catch (ResourceAccessException e) {
                last = e;
            }
            log.warn("{} failed (attempt {}/{}): {}", what, attempt, maxAttempts, last.toString());
            if (attempt < maxAttempts) pause(backoff.multipliedBy(attempt));
        }
        throw last;
    }

    private static boolean retryable(RestClientResponseException e) {
        int code = e.getStatusCode().value();
        return code == HttpStatus.TOO_MANY_REQUESTS.value() || code >= 500;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) return om.createObjectNode();
        try {
            return om.readTree(body);
        } catch (IOException e) {
            throw new IllegalStateException("unreadable response: " + e.getMessage(), e);
        }
    }

    private VersionConflictException conflict(String body) {
        JsonNode n = parse(body);
        Long yours = n.hasNonNull("your_version") ? n.get("your_version").asLong() : null;
        ChangeSource by = n.hasNonNull("last_modified_by") ? ChangeSource.fromWire(n.get("last_modified_by").asText()) : null;
        Instant at = n.hasNonNull("last_modified_at") ? Instant.parse(n.get("last_modified_at").asText()) : null;
        return new VersionConflictException(n.path("post_id").asText(null), n.path("server_version").asLong(),
                yours, by, at);
    }

    private static void pause(Duration d) {
        if (d.isZero() || d.isNegative()) return;
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while backing off", e);
        }
    }

    @FunctionalInterface
    private interface Call {
        String execute();
    }
}
