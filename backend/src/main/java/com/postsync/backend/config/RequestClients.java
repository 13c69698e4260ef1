package com.postsync.backend.config;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Who is calling. The client id labels audit and log lines; rate limiting keys on
 * the connection address, which the caller cannot choose per request.
 */
public final class RequestClients {

    public static final String CLIENT_ID_HEADER = "X-Client-Id";
    public static final String CLIENT_ID_ATTRIBUTE = "clientId";

    private RequestClients() {
    }

    public static String clientId(HttpServletRequest req) {
        Object attr = req.getAttribute(CLIENT_ID_ATTRIBUTE);
        if (attr instanceof String s) return s;
        String header = req.getHeader(CLIENT_ID_HEADER);
        if (header != null && !header.isBlank()) return header.trim();
        return req.getRemoteAddr();
    }

    public static String rateLimitKey(HttpServletRequest req) {
        return req.getRemoteAddr();
    }
}
