package com.nextride.backend.service;

import com.nextride.backend.model.RouteInfo;
import com.nextride.backend.model.Station;
import com.nextride.backend.repository.StaticDataRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lookups over the static stop and route tables used to pick stations and
 * routes.
 */
@Service
@RequiredArgsConstructor
public class StationService {

    private final StaticDataRepository staticDataRepository;

    /**
     * Parent stations, one per (name, address); the lowest stop id wins.
     */
    public List<Station> getStations() {
        Set<String> seen = new HashSet<>();
        List<Station> stations = new ArrayList<>();
        for (Station station : staticDataRepository.findStations()) {
            String key = Objects.toString(station.getStopName(), "") + '\u0000'
                    + Objects.toString(station.getAddress(), "");
            if (seen.add(key)) {
                stations.add(station);
            }
        }
        return stations;
    }

    public List<RouteInfo> getRoutes() {
        return staticDataRepository.findRoutes();
    }

    /**
     * Routes serving a stop or platform; empty when the stop is unknown.
     */
    public List<String> getTrains(String stopId) {
        return staticDataRepository.findTrains(stopId)
                .map(Station::parseTrains)
                .orElseGet(ArrayList::new);
    }
}
