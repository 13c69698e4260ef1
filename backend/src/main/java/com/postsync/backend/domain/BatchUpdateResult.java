package com.postsync.backend.domain;

import java.util.List;

public record BatchUpdateResult(List<Post> updated, List<String> conflicts, List<String> errors) {}
