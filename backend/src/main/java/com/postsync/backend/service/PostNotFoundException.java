package com.postsync.backend.service;

import java.util.NoSuchElementException;

public class PostNotFoundException extends NoSuchElementException {

    private final String postId;

    public PostNotFoundException(String postId) {
        super("post_not_found: " + postId);
        this.postId = postId;
    }

    public String postId() {
        return postId;
    }
}
