package com.nextride.backend.controller;

import com.nextride.backend.model.RouteInfo;
import com.nextride.backend.model.Station;
import com.nextride.backend.service.StationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Stations", description = "Static station and route data")
public class StationController {

    private final StationService stationService;

    @Operation(summary = "List Stations", description = "All parent stations with their address and serving routes.")
    @GetMapping("/stations")
    public List<Station> getStations() {
        return stationService.getStations();
    }

    @Operation(summary = "Routes at Stop", description = "Routes serving a station or platform (e.g. 127N).")
    @GetMapping("/stations/{stopId}/trains")
    public List<String> getTrains(
            @Parameter(description = "Stop ID", required = true) @PathVariable String stopId) {
        return stationService.getTrains(stopId);
    }

    @Operation(summary = "List Routes", description = "All routes ordered by route ID.")
    @GetMapping("/routes")
    public List<RouteInfo> getRoutes() {
        return stationService.getRoutes();
    }
}
