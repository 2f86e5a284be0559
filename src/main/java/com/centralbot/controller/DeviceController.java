package com.centralbot.controller;

import com.centralbot.dto.AckResponse;
import com.centralbot.dto.CommandsResponse;
import com.centralbot.entity.Command;
import com.centralbot.entity.DeviceStatus;
import com.centralbot.service.FleetCoordinatorService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Endpoints called by the devices themselves: heartbeat every ~30s,
 * command poll every ~10s, and an activity report after each action.
 */
@RestController
@RequestMapping("/api/device")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class DeviceController {

    private final FleetCoordinatorService fleetCoordinatorService;

    @PostMapping("/{deviceId}/heartbeat")
    public AckResponse heartbeat(@PathVariable String deviceId,
                                 @RequestBody(required = false) JsonNode report) {
        fleetCoordinatorService.recordHeartbeat(deviceId, report);
        return AckResponse.ok(fleetCoordinatorService.now());
    }

    @PostMapping("/{deviceId}/activity")
    public AckResponse activity(@PathVariable String deviceId,
                                @RequestBody(required = false) JsonNode report) {
        fleetCoordinatorService.recordActivity(deviceId, report);
        return AckResponse.ok();
    }

    @GetMapping("/{deviceId}/commands")
    public CommandsResponse commands(@PathVariable String deviceId) {
        List<Command> commands = fleetCoordinatorService.pollCommands(deviceId);
        return new CommandsResponse(commands, fleetCoordinatorService.now());
    }
}
