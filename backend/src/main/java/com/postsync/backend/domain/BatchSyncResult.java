package com.postsync.backend.domain;

import java.util.List;

public record BatchSyncResult(int created, int updated, List<String> conflicts, List<String> errors) {}
