package com.centralbot.dto;

import java.time.LocalDateTime;

public record HealthDto(String status, LocalDateTime timestamp) {
}
