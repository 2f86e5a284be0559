package com.centralbot.repository;

import com.centralbot.entity.ActivityEntry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-device activity history, newest first and capped at a fixed length.
 * Each device's list is copy-on-write; the oldest entry falls off silently.
 */
@Repository
public class ActivityLogRepository {

    private final Map<String, List<ActivityEntry>> activities = new ConcurrentHashMap<>();
    private final int historyLimit;
    private final int previewLimit;

    public ActivityLogRepository(@Value("${central-bot.activity.history-limit:50}") int historyLimit,
                                 @Value("${central-bot.activity.preview-limit:100}") int previewLimit) {
        this.historyLimit = historyLimit;
        this.previewLimit = previewLimit;
    }

    /**
     * Stores {@code entry} at the front of the device's history. The content
     * preview is cut to the configured length here and never revisited.
     */
    public ActivityEntry append(String deviceId, ActivityEntry entry) {
        ActivityEntry stored = new ActivityEntry(
                entry.getTimestamp(),
                entry.getAction(),
                entry.isSuccess(),
                entry.getDetails(),
                truncate(entry.getContentPreview(), previewLimit));

        activities.compute(deviceId, (id, current) -> {
            List<ActivityEntry> next = new ArrayList<>(historyLimit);
            next.add(stored);
            if (current != null) {
                next.addAll(current.subList(0, Math.min(current.size(), historyLimit - 1)));
            }
            return List.copyOf(next);
        });
        return stored;
    }

    List<ActivityEntry> findByDeviceId(String deviceId) {
        return activities.getOrDefault(deviceId, List.of());
    }

    /** Timestamp of the newest entry; empty when the device has never reported. */
    public Optional<LocalDateTime> mostRecentTimestamp(String deviceId) {
        List<ActivityEntry> entries = activities.get(deviceId);
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(0).getTimestamp());
    }

    public Map<String, List<ActivityEntry>> snapshotAll() {
        return Collections.unmodifiableMap(new TreeMap<>(activities));
    }

    static String truncate(String value, int maxCodePoints) {
        if (value == null) {
            return "";
        }
        if (value.codePointCount(0, value.length()) <= maxCodePoints) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, maxCodePoints));
    }
}
