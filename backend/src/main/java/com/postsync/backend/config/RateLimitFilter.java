package com.postsync.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.postsync.backend.service.ratelimit.RateLimitedException;
import com.postsync.backend.service.ratelimit.RateLimiter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs before authentication so unauthenticated floods are throttled too.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimiter limiter;
    private final ObjectMapper om;

    public RateLimitFilter(RateLimiter limiter, ObjectMapper om) {
        this.limiter = limiter;
        this.om = om;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) return true;
        String p = request.getRequestURI();
        return !(p.startsWith("/sync/") || p.startsWith("/api/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        req.setAttribute(RequestClients.CLIENT_ID_ATTRIBUTE, RequestClients.clientId(req));
        try {
            limiter.acquire(RequestClients.rateLimitKey(req));
        } catch (RateLimitedException e) {
            tooManyRequests(res, e);
            return;
        }
        chain.doFilter(req, res);
    }

    private void tooManyRequests(HttpServletResponse res, RateLimitedException e) throws IOException {
        res.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        res.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(e.retryAfterSeconds()));
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "RateLimited");
        body.put("message", "Too many requests, retry later");
        body.put("retry_after_seconds", e.retryAfterSeconds());
        om.writeValue(res.getWriter(), body);
    }
}
