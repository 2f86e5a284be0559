package com.centralbot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregated fleet analytics. Every ratio is 0 when its denominator is 0.
 */
public record FleetAnalyticsDto(
        @JsonProperty("fleet_overview") FleetOverview fleetOverview,
        @JsonProperty("action_breakdown") ActionBreakdown actionBreakdown,
        @JsonProperty("device_details") List<DeviceDetail> deviceDetails,
        @JsonProperty("performance_metrics") PerformanceMetrics performanceMetrics,
        @JsonProperty("top_performers") List<DeviceDetail> topPerformers) {

    public record FleetOverview(
            @JsonProperty("total_devices") int totalDevices,
            @JsonProperty("online_devices") int onlineDevices,
            @JsonProperty("offline_devices") int offlineDevices,
            @JsonProperty("total_uptime_hours") double totalUptimeHours,
            @JsonProperty("average_uptime_hours") double averageUptimeHours) {
    }

    public record ActionBreakdown(
            @JsonProperty("total_actions") BigDecimal totalActions,
            BigDecimal tweets,
            BigDecimal replies,
            BigDecimal retweets,
            @JsonProperty("tweet_percentage") double tweetPercentage,
            @JsonProperty("reply_percentage") double replyPercentage,
            @JsonProperty("retweet_percentage") double retweetPercentage) {
    }

    public record DeviceDetail(
            String id,
            String name,
            String status,
            @JsonProperty("uptime_hours") JsonNode uptimeHours,
            @JsonProperty("actions_today") JsonNode actionsToday,
            @JsonProperty("total_actions") BigDecimal totalActions,
            @JsonProperty("last_activity") String lastActivity,
            @JsonProperty("cpu_usage") JsonNode cpuUsage,
            @JsonProperty("memory_usage") JsonNode memoryUsage) {
    }

    public record PerformanceMetrics(
            @JsonProperty("avg_actions_per_device") double avgActionsPerDevice,
            @JsonProperty("uptime_percentage") double uptimePercentage,
            @JsonProperty("action_efficiency") double actionEfficiency,
            @JsonProperty("device_health_score") double deviceHealthScore) {
    }
}
