package com.centralbot.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Status snapshot of one device, replaced wholesale on every heartbeat.
 * Agent-reported values are kept exactly as they arrived.
 */
@Value
@Builder(toBuilder = true)
public class DeviceStatus {

    public static final String NEVER = "Never";

    @JsonIgnore
    String deviceId;

    @JsonProperty("status")
    DeviceState status;

    @JsonProperty("last_seen")
    LocalDateTime lastSeen;

    @JsonProperty("uptime_hours")
    JsonNode uptimeHours;

    @JsonProperty("cpu_usage")
    JsonNode cpuUsage;

    @JsonProperty("memory_usage")
    JsonNode memoryUsage;

    @JsonProperty("actions_today")
    JsonNode actionsToday;

    @JsonProperty("next_scheduled")
    JsonNode nextScheduled;

    @JsonProperty("content_version")
    JsonNode contentVersion;

    @JsonProperty("twitter_logged_in")
    JsonNode twitterLoggedIn;

    // newest activity seen for this device; null until one is reported
    @JsonIgnore
    LocalDateTime lastActivityAt;

    @JsonProperty("last_activity")
    public String getLastActivity() {
        return lastActivityAt != null ? format(lastActivityAt) : NEVER;
    }

    @JsonIgnore
    public boolean isOnline() {
        return status == DeviceState.ONLINE;
    }

    public static String format(LocalDateTime timestamp) {
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp);
    }
}
