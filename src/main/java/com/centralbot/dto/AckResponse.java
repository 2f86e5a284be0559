package com.centralbot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AckResponse(boolean success, LocalDateTime timestamp) {

    public static AckResponse ok() {
        return new AckResponse(true, null);
    }

    public static AckResponse ok(LocalDateTime timestamp) {
        return new AckResponse(true, timestamp);
    }
}
