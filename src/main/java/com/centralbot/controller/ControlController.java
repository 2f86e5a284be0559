package com.centralbot.controller;

import com.centralbot.dto.ControlResponse;
import com.centralbot.service.FleetCoordinatorService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operator controls. Commands are queued and picked up on the device's next poll.
 */
@RestController
@RequestMapping("/api/control")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ControlController {

    private final FleetCoordinatorService fleetCoordinatorService;

    @PostMapping("/stop/{deviceId}")
    public ControlResponse stop(@PathVariable String deviceId) {
        fleetCoordinatorService.stopDevice(deviceId);
        return new ControlResponse("Stop command sent to " + deviceId);
    }

    @PostMapping("/restart/{deviceId}")
    public ControlResponse restart(@PathVariable String deviceId,
                                   @RequestBody(required = false) JsonNode params) {
        fleetCoordinatorService.restartDevice(deviceId, params);
        return new ControlResponse("Restart command sent to " + deviceId);
    }

    @PostMapping("/emergency_stop_all")
    public ControlResponse emergencyStopAll() {
        List<String> stopped = fleetCoordinatorService.emergencyStopAll();
        return new ControlResponse(true, "Emergency stop sent to " + stopped.size() + " devices", stopped);
    }
}
