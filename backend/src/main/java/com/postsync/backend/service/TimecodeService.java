package com.postsync.backend.service;

import com.postsync.backend.domain.ChangeSource;
import com.postsync.backend.domain.ControlSystemPayload;
import com.postsync.backend.domain.Post;
import com.postsync.backend.domain.PostStatus;
import com.postsync.backend.domain.TimecodeEntry;
import com.postsync.backend.repo.InMemoryStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Timecode log fed by control systems. TC-IN opens a take and marks the post as
 * recording, TC-OUT closes the newest open take of that post and marks it recorded.
 */
@Service
public class TimecodeService {

    public static final int FRAMES_PER_SECOND = 25;
    private static final Pattern TIMECODE = Pattern.compile("(\\d{2}):([0-5]\\d):([0-5]\\d)[:;](\\d{2})");

    private final InMemoryStore store;
    private final SyncCoordinator coordinator;
    private final Clock clock;

    public TimecodeService(InMemoryStore store, SyncCoordinator coordinator, Clock clock) {
        this.store = store;
        this.coordinator = coordinator;
        this.clock = clock;
    }

    public Map<String, Object> handle(ControlSystemPayload payload, String actor) {
        if (payload == null || payload.action() == null) throw new ValidationException("action_required");
        if (payload.postId() == null || payload.postId().isBlank()) throw new ValidationException("post_id_required");
        String who = payload.operator() != null ? payload.operator() : actor;

        Map<String, Object> out = new LinkedHashMap<>();
        switch (payload.action().trim().toLowerCase(Locale.ROOT)) {
            case "tc_in" -> {
                out.put("action", "tc_in");
                out.put("entry", tcIn(payload.postId(), payload.tcIn(), payload.clipNr(), who));
            }
            case "tc_out" -> {
                out.put("action", "tc_out");
                out.put("entry", tcOut(payload.postId(), payload.tcOut(), who).orElse(null));
            }
            default -> throw new ValidationException("invalid_action: " + payload.action());
        }
        out.put("post", coordinator.versionOf(payload.postId()));
        return out;
    }

    public synchronized TimecodeEntry tcIn(String postId, String tcIn, Integer clipNr, String operator) {
        parseSeconds(tcIn);
        Post post = coordinator.changeStatus(postId, PostStatus.RECORDING, null, ChangeSource.CONTROL_SYSTEM, operator);
        TimecodeEntry entry = new TimecodeEntry(UUID.randomUUID().toString(), post.postId(), operator, tcIn,
                null, clipNr, null, clock.instant());
        store.timecodes.add(entry);
        return entry;
    }

    public synchronized Optional<TimecodeEntry> tcOut(String postId, String tcOut, String operator) {
        double outSeconds = parseSeconds(tcOut);
        coordinator.changeStatus(postId, PostStatus.RECORDED, null, ChangeSource.CONTROL_SYSTEM, operator);

        for (int i = store.timecodes.size() - 1; i >= 0; i--) {
            TimecodeEntry e = store.timecodes.get(i);
            if (e.postId().equals(postId) && e.open()) {
                int duration = (int) Math.max(0, Math.round(outSeconds - parseSeconds(e.tcIn())));
                TimecodeEntry closed = e.close(tcOut, duration);
                store.timecodes.set(i, closed);
                return Optional.of(closed);
            }
        }
        return Optional.empty();
    }

    public List<TimecodeEntry> list(String postId) {
        return store.timecodes.stream()
                .filter(e -> postId == null || postId.isBlank() || e.postId().equals(postId))
                .toList();
    }

    public List<TimecodeEntry> all() {
        return List.copyOf(store.timecodes);
    }

    public synchronized void replaceAll(Collection<TimecodeEntry> entries) {
        store.timecodes.clear();
        if (entries != null) store.timecodes.addAll(entries);
    }

    /** HH:MM:SS:FF at 25 fps to seconds. */
    static double parseSeconds(String timecode) {
        if (timecode == null) throw new ValidationException("timecode_required");
        Matcher m = TIMECODE.matcher(timecode.trim());
        if (!m.matches()) throw new ValidationException("invalid_timecode: " + timecode);
        int frames = Integer.parseInt(m.group(4));
        if (frames >= FRAMES_PER_SECOND) throw new ValidationException("invalid_timecode: " + timecode);
        return Integer.parseInt(m.group(1)) * 3600
                + Integer.parseInt(m.group(2)) * 60
                + Integer.parseInt(m.group(3))
                + frames / (double) FRAMES_PER_SECOND;
    }
}
