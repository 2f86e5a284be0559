package com.centralbot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Map;

public record ServiceInfoDto(
        String service,
        String version,
        String status,
        LocalDateTime timestamp,
        @JsonProperty("connected_devices") int connectedDevices,
        Map<String, String> endpoints) {
}
