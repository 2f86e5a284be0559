package com.centralbot.controller;

import com.centralbot.dto.AnalyticsResponse;
import com.centralbot.dto.FleetStatusDto;
import com.centralbot.service.FleetAnalyticsService;
import com.centralbot.service.FleetCoordinatorService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class StatusController {

    private final FleetCoordinatorService fleetCoordinatorService;
    private final FleetAnalyticsService fleetAnalyticsService;

    @GetMapping("/all")
    public FleetStatusDto all() {
        return fleetCoordinatorService.fleetStatus();
    }

    @GetMapping("/analytics")
    public AnalyticsResponse analytics() {
        return new AnalyticsResponse(fleetCoordinatorService.now(), fleetAnalyticsService.analytics());
    }
}
