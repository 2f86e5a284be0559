package com.centralbot.dto;

import com.centralbot.entity.Command;

import java.time.LocalDateTime;
import java.util.List;

public record CommandsResponse(List<Command> commands, LocalDateTime timestamp) {
}
