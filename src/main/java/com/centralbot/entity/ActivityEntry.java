package com.centralbot.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivityEntry {

    private LocalDateTime timestamp;

    private String action;

    private boolean success;

    private String details;

    // Truncated when the entry is recorded
    @JsonProperty("content_preview")
    private String contentPreview;
}
