package com.centralbot.service;

import com.centralbot.dto.FleetStatusDto;
import com.centralbot.entity.ActivityEntry;
import com.centralbot.entity.Command;
import com.centralbot.entity.DeviceState;
import com.centralbot.entity.DeviceStatus;
import com.centralbot.repository.ActivityLogRepository;
import com.centralbot.repository.CommandQueueRepository;
import com.centralbot.repository.DeviceStatusRepository;
import com.centralbot.repository.RegistrySnapshot;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Coordinates the fleet: ingests heartbeats and activity reports, hands out
 * queued commands, and turns operator controls into queued commands.
 *
 * Fleet-wide reads evict stale devices first; there is no background sweep.
 */
@Service
@Slf4j
public class FleetCoordinatorService {

    public static final String STOP_ACTION = "stop_bot";
    public static final String RESTART_ACTION = "restart_bot";
    public static final String EMERGENCY_STOP_ACTION = "emergency_stop";

    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };

    private final DeviceStatusRepository deviceStatusRepository;
    private final ActivityLogRepository activityLogRepository;
    private final CommandQueueRepository commandQueueRepository;
    private final CommandIdGenerator commandIdGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration staleThreshold;
    private final int queueWarnDepth;

    public FleetCoordinatorService(DeviceStatusRepository deviceStatusRepository,
                                   ActivityLogRepository activityLogRepository,
                                   CommandQueueRepository commandQueueRepository,
                                   CommandIdGenerator commandIdGenerator,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   @Value("${central-bot.stale-threshold:10m}") Duration staleThreshold,
                                   @Value("${central-bot.commands.queue-warn-depth:100}") int queueWarnDepth) {
        this.deviceStatusRepository = deviceStatusRepository;
        this.activityLogRepository = activityLogRepository;
        this.commandQueueRepository = commandQueueRepository;
        this.commandIdGenerator = commandIdGenerator;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.staleThreshold = staleThreshold;
        this.queueWarnDepth = queueWarnDepth;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    // --- Device side ---

    /**
     * Replaces the device's status with a fresh online snapshot built from
     * the report. last_activity comes from the activity log, not the report.
     *
     * @return the stored row
     */
    public DeviceStatus recordHeartbeat(String deviceId, JsonNode body) {
        JsonNode report = ReportFields.objectOrEmpty(body);

        DeviceStatus status = DeviceStatus.builder()
                .deviceId(deviceId)
                .status(DeviceState.ONLINE)
                .lastSeen(now())
                .uptimeHours(ReportFields.node(report, "uptime_hours", IntNode.valueOf(0)))
                .cpuUsage(ReportFields.node(report, "cpu_usage", IntNode.valueOf(0)))
                .memoryUsage(ReportFields.node(report, "memory_usage", IntNode.valueOf(0)))
                .actionsToday(ReportFields.node(report, "actions_today", JsonNodeFactory.instance.objectNode()))
                .nextScheduled(ReportFields.node(report, "next_scheduled", JsonNodeFactory.instance.nullNode()))
                .contentVersion(ReportFields.node(report, "content_version", TextNode.valueOf("unknown")))
                .twitterLoggedIn(ReportFields.node(report, "twitter_logged_in", BooleanNode.FALSE))
                .lastActivityAt(activityLogRepository.mostRecentTimestamp(deviceId).orElse(null))
                .build();

        deviceStatusRepository.save(status);
        // an activity recorded while the row was being built must not be lost
        activityLogRepository.mostRecentTimestamp(deviceId)
                .ifPresent(latest -> deviceStatusRepository.updateLastActivity(deviceId, latest));
        log.info("Heartbeat from {}: {}", deviceId, status.getActionsToday());
        return deviceStatusRepository.findById(deviceId).orElse(status);
    }

    public ActivityEntry recordActivity(String deviceId, JsonNode body) {
        JsonNode report = ReportFields.objectOrEmpty(body);
        ActivityEntry entry = new ActivityEntry(
                now(),
                ReportFields.text(report, "action", "unknown"),
                ReportFields.bool(report, "success", false),
                ReportFields.text(report, "details", ""),
                ReportFields.text(report, "content_preview", ""));

        ActivityEntry stored = activityLogRepository.append(deviceId, entry);
        deviceStatusRepository.updateLastActivity(deviceId, stored.getTimestamp());
        log.info("Activity from {}: {}", deviceId, stored.getAction());
        return stored;
    }

    /** Hands over every pending command; they are not kept for redelivery. */
    public List<Command> pollCommands(String deviceId) {
        List<Command> commands = commandQueueRepository.drain(deviceId);
        if (!commands.isEmpty()) {
            log.info("Sending {} commands to {}", commands.size(), deviceId);
        }
        return commands;
    }

    // --- Operator side ---

    public Command enqueueCommand(String deviceId, String action, Map<String, Object> parameters) {
        Command command = new Command(
                commandIdGenerator.nextId(action),
                action,
                parameters != null ? parameters : new HashMap<>(),
                now());

        int depth = commandQueueRepository.enqueue(deviceId, command);
        if (depth > queueWarnDepth) {
            log.warn("Command queue for {} holds {} undelivered commands", deviceId, depth);
        }
        return command;
    }

    public Command stopDevice(String deviceId) {
        Map<String, Object> params = new HashMap<>();
        params.put("reason", "Manual stop from Control Room");
        Command command = enqueueCommand(deviceId, STOP_ACTION, params);
        log.info("Stop command sent to {}", deviceId);
        return command;
    }

    public Command restartDevice(String deviceId, JsonNode body) {
        Map<String, Object> params = objectMapper.convertValue(ReportFields.objectOrEmpty(body), PARAMS_TYPE);
        Command command = enqueueCommand(deviceId, RESTART_ACTION, params);
        log.info("Restart command sent to {}", deviceId);
        return command;
    }

    /**
     * Queues an emergency stop for every device registered right now.
     * Devices that show up afterwards are not included.
     */
    public List<String> emergencyStopAll() {
        List<String> targets = deviceStatusRepository.findAllIds();
        for (String deviceId : targets) {
            Map<String, Object> params = new HashMap<>();
            params.put("priority", "critical");
            enqueueCommand(deviceId, EMERGENCY_STOP_ACTION, params);
        }
        log.warn("EMERGENCY STOP sent to {} devices", targets.size());
        return targets;
    }

    // --- Fleet reads ---

    public void evictStale() {
        List<String> evicted = deviceStatusRepository.evictStale(now(), staleThreshold);
        for (String deviceId : evicted) {
            log.info("Evicted {} after more than {} without heartbeat", deviceId, staleThreshold);
        }
    }

    /** Evicts stale devices, then returns a consistent copy of the registry. */
    public RegistrySnapshot currentFleet() {
        evictStale();
        return deviceStatusRepository.snapshotAll();
    }

    public FleetStatusDto fleetStatus() {
        RegistrySnapshot snapshot = currentFleet();
        return new FleetStatusDto(
                now(),
                snapshot.devices(),
                activityLogRepository.snapshotAll(),
                snapshot.totalCount(),
                snapshot.onlineCount());
    }

    public int connectedDevices() {
        return deviceStatusRepository.count();
    }
}
