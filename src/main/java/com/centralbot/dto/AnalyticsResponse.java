package com.centralbot.dto;

import java.time.LocalDateTime;

public record AnalyticsResponse(LocalDateTime timestamp, FleetAnalyticsDto analytics) {
}
