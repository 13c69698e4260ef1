package com.postsync.backend.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared-secret check for every mutating call. The secret may come as
 * {@code X-Webhook-Secret}, {@code X-Api-Key} or an {@code api_key} body field.
 * Reads stay public apart from the full-state dumps. Without a configured secret
 * nothing is enforced.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class ApiKeyFilter extends OncePerRequestFilter {

    public static final String WEBHOOK_SECRET_HEADER = "X-Webhook-Secret";
    public static final String API_KEY_HEADER = "X-Api-Key";

    private static final List<String> PROTECTED_READS = List.of("/api/export", "/api/backups");

    private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);

    private final ObjectMapper om;
    private final byte[] secret;

    public ApiKeyFilter(PostSyncProperties props, ObjectMapper om) {
        this.om = om;
        if (props.security().enforced()) {
            this.secret = props.security().sharedSecret().getBytes(StandardCharsets.UTF_8);
        } else {
            this.secret = null;
            log.warn("postsync.security.shared-secret is not set: sync and api writes are UNPROTECTED");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (secret == null) return true;
        String m = request.getMethod();
        String p = request.getRequestURI();
        if ("OPTIONS".equalsIgnoreCase(m)) return true;
        if (("GET".equalsIgnoreCase(m) || "HEAD".equalsIgnoreCase(m)) && !PROTECTED_READS.contains(p)) return true;
        return !(p.startsWith("/sync/") || p.startsWith("/api/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String presented = header(req, WEBHOOK_SECRET_HEADER);
        if (presented == null) presented = header(req, API_KEY_HEADER);

        HttpServletRequest forward = req;
        if (presented == null && isJson(req)) {
            CachedBodyRequest cached = new CachedBodyRequest(req);
            presented = bodyApiKey(cached.body());
            forward = cached;
        }

        if (presented == null) {
            unauthorized(res, "missing_secret");
            return;
        }
        if (!MessageDigest.isEqual(secret, presented.getBytes(StandardCharsets.UTF_8))) {
            log.warn("rejected {} {} from {}: bad secret", req.getMethod(), req.getRequestURI(),
                    RequestClients.clientId(req));
            unauthorized(res, "invalid_secret");
            return;
        }
        chain.doFilter(forward, res);
    }

    private String bodyApiKey(byte[] body) {
        if (body.length == 0) return null;
        try {
            JsonNode node = om.readTree(body);
            return node != null && node.hasNonNull("api_key") ? node.get("api_key").asText() : null;
        } catch (IOException e) {
            // malformed bodies are rejected as unauthenticated here, as 400 further down otherwise
            return null;
        }
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static boolean isJson(HttpServletRequest req) {
        String ct = req.getContentType();
        return ct != null && ct.toLowerCase(Locale.ROOT).contains("json");
    }

    private void unauthorized(HttpServletResponse res, String code) throws IOException {
        res.setStatus(HttpStatus.UNAUTHORIZED.value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        om.writeValue(res.getWriter(), Map.of("error", "Unauthorized", "message", code));
    }
}
