package com.nextride.backend.repository;

import com.nextride.backend.model.RouteInfo;
import com.nextride.backend.model.Station;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the static schedule tables loaded by the schedule importer.
 */
public interface StaticDataRepository {

    /**
     * Parent stations (ids without a direction suffix) ordered by name,
     * address and id.
     */
    List<Station> findStations();

    List<RouteInfo> findRoutes();

    /**
     * Raw comma-joined list of routes serving a stop.
     */
    Optional<String> findTrains(String stopId);
}
