package com.postsync.backend.service;

import com.postsync.backend.domain.GroupStats;
import com.postsync.backend.domain.Post;
import com.postsync.backend.domain.PostStatus;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Derived read views over active posts: filtered listing, recording schedule, progress.
 */
@Service
public class ScheduleService {

    private final PostStore posts;

    public ScheduleService(PostStore posts) {
        this.posts = posts;
    }

    public List<Post> listActive(Integer groupId, PostStatus status) {
        List<Post> base = groupId != null ? posts.listByGroup(groupId) : posts.listActive();
        return base.stream()
                .filter(p -> status == null || p.status() == status)
                .collect(Collectors.toList());
    }

    /** Posts recorded on {@code day}, in running order: group, then sort order. */
    public List<Post> schedule(String day) {
        String d = day == null || day.isBlank() ? "day1" : day.trim();
        return posts.listActive().stream()
                .filter(p -> d.equals(p.recordingDay()))
                .collect(Collectors.toList());
    }

    public List<GroupStats> stats() {
        Map<Integer, List<Post>> byGroup = posts.listActive().stream()
                .collect(Collectors.groupingBy(Post::groupId, TreeMap::new, Collectors.toList()));

        List<GroupStats> out = new ArrayList<>();
        byGroup.forEach((group, list) -> {
            Map<PostStatus, Long> counts = list.stream()
                    .collect(Collectors.groupingBy(Post::status, () -> new EnumMap<>(PostStatus.class), Collectors.counting()));
            int recorded = counts.getOrDefault(PostStatus.RECORDED, 0L).intValue();
            int approved = counts.getOrDefault(PostStatus.APPROVED, 0L).intValue();
            double progress = list.isEmpty() ? 0.0
                    : Math.round(1000.0 * (recorded + approved) / list.size()) / 10.0;
            out.add(new GroupStats(
                    group,
                    list.size(),
                    counts.getOrDefault(PostStatus.PLANNED, 0L).intValue(),
                    counts.getOrDefault(PostStatus.RECORDING, 0L).intValue(),
                    recorded,
                    approved,
                    list.stream().mapToLong(Post::durationSeconds).sum(),
                    progress
            ));
        });
        return out;
    }
}
