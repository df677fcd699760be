package com.nextride.backend.controller;

import com.nextride.backend.model.Departure;
import com.nextride.backend.model.Direction;
import com.nextride.backend.service.DepartureService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/departures")
@RequiredArgsConstructor
@Tag(name = "Departures", description = "Upcoming departures from live trip updates")
public class DepartureController {

    private final DepartureService departureService;

    @Operation(summary = "Next Departure per Route", description = "Returns the next departure of every route serving a platform, ordered by route.")
    @GetMapping("/{stopId}")
    public List<Departure> getStationDepartures(
            @Parameter(description = "Platform stop ID including direction (e.g. 127N)", required = true) @PathVariable String stopId) {
        return departureService.getStationDepartures(stopId);
    }

    @Operation(summary = "Next Departures of a Route", description = "Returns up to three upcoming departures of one route from a platform.")
    @GetMapping("/{stopId}/routes/{routeId}")
    public List<Departure> getRouteDepartures(
            @Parameter(description = "Platform stop ID including direction (e.g. 127N)", required = true) @PathVariable String stopId,
            @Parameter(description = "Route ID (e.g. 1, A, GS)", required = true) @PathVariable String routeId) {
        return departureService.getRouteDepartures(stopId, routeId);
    }

    @Operation(summary = "Departures by Direction", description = "Returns next departures per route for both the northbound and southbound platforms of a station.")
    @GetMapping("/stations/{stationId}")
    public Map<Direction, List<Departure>> getDirectionalDepartures(
            @Parameter(description = "Station ID without direction (e.g. 127)", required = true) @PathVariable String stationId) {
        return departureService.getDirectionalDepartures(stationId);
    }

    @Operation(summary = "Departures in One Direction", description = "Returns next departures per route for one platform of a station. Direction is N, S, northbound or southbound.")
    @GetMapping("/stations/{stationId}/{direction}")
    public List<Departure> getDirectionDepartures(
            @Parameter(description = "Station ID without direction (e.g. 127)", required = true) @PathVariable String stationId,
            @Parameter(description = "Direction of travel (e.g. N)", required = true) @PathVariable String direction) {
        return departureService.getDirectionDepartures(stationId, Direction.parse(direction));
    }
}
