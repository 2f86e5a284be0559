package com.centralbot.dto;

import com.centralbot.entity.ActivityEntry;
import com.centralbot.entity.DeviceStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record FleetStatusDto(
        LocalDateTime timestamp,
        Map<String, DeviceStatus> devices,
        @JsonProperty("recent_activities") Map<String, List<ActivityEntry>> recentActivities,
        @JsonProperty("total_devices") int totalDevices,
        @JsonProperty("online_devices") int onlineDevices) {
}
