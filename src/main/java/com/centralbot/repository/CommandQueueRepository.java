package com.centralbot.repository;

import com.centralbot.entity.Command;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unbounded per-device FIFO of undelivered commands.
 *
 * Enqueue and drain for the same device serialize on the map bin, so a
 * command lands either in the drain running next to it or in the following one.
 */
@Repository
public class CommandQueueRepository {

    private final Map<String, List<Command>> queues = new ConcurrentHashMap<>();

    /**
     * Appends {@code command} to the tail of the device's queue.
     *
     * @return queue depth right after the append
     */
    public int enqueue(String deviceId, Command command) {
        int[] depth = new int[1];
        queues.compute(deviceId, (id, current) -> {
            List<Command> queue = current != null ? current : new ArrayList<>();
            queue.add(command);
            depth[0] = queue.size();
            return queue;
        });
        return depth[0];
    }

    /** Returns everything queued for the device and leaves the queue empty. */
    public List<Command> drain(String deviceId) {
        List<Command> drained = queues.remove(deviceId);
        return drained != null ? List.copyOf(drained) : List.of();
    }
}
