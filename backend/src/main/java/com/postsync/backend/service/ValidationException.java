package com.postsync.backend.service;

/**
 * Caller mistake: missing or malformed fields. Never retried.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
