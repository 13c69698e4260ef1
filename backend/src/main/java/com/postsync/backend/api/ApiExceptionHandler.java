package com.postsync.backend.api;

import com.postsync.backend.service.VersionConflictException;
import com.postsync.backend.service.ratelimit.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NoSuchElementException e) {
        return Map.of(
                "error", "NOT_FOUND",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNoRoute(NoResourceFoundException e) {
        return Map.of("error", "NOT_FOUND", "message", "no_route: " + e.getResourcePath());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            HttpMessageConversionException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(Exception e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", e instanceof HttpMessageConversionException ? "malformed_json" : String.valueOf(e.getMessage())
        );
    }

    // routine under concurrent editing: debug, not error
    @ExceptionHandler(VersionConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(VersionConflictException e) {
        log.debug("409 for {}: server v{}, client v{}", e.postId(), e.serverVersion(), e.yourVersion());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Conflict");
        body.put("message", e.getMessage());
        body.put("post_id", e.postId());
        body.put("server_version", e.serverVersion());
        body.put("your_version", e.yourVersion());
        body.put("last_modified_by", e.lastModifiedBy() == null ? null : e.lastModifiedBy().wire());
        body.put("last_modified_at", e.lastModifiedAt());
        return body;
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimited(RateLimitedException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.retryAfterSeconds()))
                .body(Map.of(
                        "error", "RateLimited",
                        "retry_after_seconds", e.retryAfterSeconds()
                ));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    public Map<String, Object> handleMethod(HttpRequestMethodNotSupportedException e) {
        return Map.of("error", "METHOD_NOT_ALLOWED", "message", String.valueOf(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception e) {
        log.error("unhandled error", e);
        return Map.of(
                "error", "InternalError",
                "message", "Internal server error"
        );
    }
}
