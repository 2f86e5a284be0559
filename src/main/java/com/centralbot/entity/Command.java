package com.centralbot.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Operator command waiting in a device queue. Once drained it is handed to
 * the device and forgotten.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Command {

    @JsonProperty("command_id")
    private String commandId;

    private String action;

    private Map<String, Object> parameters;

    private LocalDateTime timestamp;
}
