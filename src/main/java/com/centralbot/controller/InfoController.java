package com.centralbot.controller;

import com.centralbot.dto.HealthDto;
import com.centralbot.dto.ServiceInfoDto;
import com.centralbot.service.FleetCoordinatorService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
public class InfoController {

    private static final Map<String, String> ENDPOINTS = new LinkedHashMap<>();

    static {
        ENDPOINTS.put("device_heartbeat", "/api/device/<id>/heartbeat [POST]");
        ENDPOINTS.put("device_activity", "/api/device/<id>/activity [POST]");
        ENDPOINTS.put("device_commands", "/api/device/<id>/commands [GET]");
        ENDPOINTS.put("control_stop", "/api/control/stop/<id> [POST]");
        ENDPOINTS.put("control_restart", "/api/control/restart/<id> [POST]");
        ENDPOINTS.put("emergency_stop", "/api/control/emergency_stop_all [POST]");
        ENDPOINTS.put("fleet_status", "/api/status/all [GET]");
        ENDPOINTS.put("analytics", "/api/status/analytics [GET]");
    }

    private final FleetCoordinatorService fleetCoordinatorService;
    private final String serviceName;
    private final String version;

    public InfoController(FleetCoordinatorService fleetCoordinatorService,
                          @Value("${central-bot.service-name:Central Bot API}") String serviceName,
                          @Value("${central-bot.version:1.0.0}") String version) {
        this.fleetCoordinatorService = fleetCoordinatorService;
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping("/")
    public ServiceInfoDto home() {
        return new ServiceInfoDto(serviceName, version, "running", fleetCoordinatorService.now(),
                fleetCoordinatorService.connectedDevices(), ENDPOINTS);
    }

    // Liveness only; does not touch fleet state
    @GetMapping("/health")
    public HealthDto health() {
        return new HealthDto("healthy", fleetCoordinatorService.now());
    }
}
