package com.centralbot.repository;

import com.centralbot.entity.DeviceStatus;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory device registry keyed by device id. Rows are immutable and
 * replaced atomically, so readers never see a half-written status.
 */
@Repository
public class DeviceStatusRepository {

    private final ConcurrentNavigableMap<String, DeviceStatus> devices = new ConcurrentSkipListMap<>();

    public DeviceStatus save(DeviceStatus status) {
        devices.put(status.getDeviceId(), status);
        return status;
    }

    public Optional<DeviceStatus> findById(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    /**
     * Moves last_activity of an existing row forward to {@code activityAt}.
     * Older timestamps are ignored, so writers racing on the same row settle
     * on the newest activity. Unknown ids are ignored.
     */
    public void updateLastActivity(String deviceId, LocalDateTime activityAt) {
        devices.computeIfPresent(deviceId, (id, current) -> {
            LocalDateTime known = current.getLastActivityAt();
            if (known != null && !activityAt.isAfter(known)) {
                return current;
            }
            return current.toBuilder().lastActivityAt(activityAt).build();
        });
    }

    /**
     * Removes every row whose last heartbeat is more than {@code threshold}
     * before {@code now}. Activity history and queued commands are not touched.
     *
     * @return ids of the removed devices
     */
    public List<String> evictStale(LocalDateTime now, Duration threshold) {
        List<String> evicted = new ArrayList<>();
        for (Map.Entry<String, DeviceStatus> entry : devices.entrySet()) {
            DeviceStatus current = entry.getValue();
            boolean stale = Duration.between(current.getLastSeen(), now).compareTo(threshold) > 0;
            // a heartbeat that replaced the row meanwhile keeps it alive
            if (stale && devices.remove(entry.getKey(), current)) {
                evicted.add(entry.getKey());
            }
        }
        return evicted;
    }

    public RegistrySnapshot snapshotAll() {
        Map<String, DeviceStatus> copy = new LinkedHashMap<>(devices);
        int online = (int) copy.values().stream().filter(DeviceStatus::isOnline).count();
        return new RegistrySnapshot(Collections.unmodifiableMap(copy), online);
    }

    public List<String> findAllIds() {
        return List.copyOf(devices.keySet());
    }

    public int count() {
        return devices.size();
    }
}
