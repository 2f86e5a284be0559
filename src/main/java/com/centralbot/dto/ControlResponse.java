package com.centralbot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Reply to an operator control call. {@code devices} is only set for fleet-wide commands.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ControlResponse(boolean success, String message, List<String> devices) {

    public ControlResponse(String message) {
        this(true, message, null);
    }
}
