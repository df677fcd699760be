package com.nextride.backend.repository;

import com.nextride.backend.model.Departure;
import com.nextride.backend.model.StopTimeUpdate;
import com.nextride.backend.model.TripUpdate;

import java.time.Instant;
import java.util.List;

/**
 * Live trip and stop-time state.
 */
public interface RealtimeRepository {

    /**
     * Replace all live trips and stop times with the given batch in a single
     * transaction. Callers pass batches free of duplicate keys.
     */
    void replaceLiveState(List<TripUpdate> tripUpdates, List<StopTimeUpdate> stopTimeUpdates);

    List<TripUpdate> findAllTripUpdates();

    List<StopTimeUpdate> findAllStopTimeUpdates();

    /**
     * Departures from a platform strictly after {@code now}, ordered by route
     * id then departure time.
     */
    List<Departure> findDeparturesAfter(String stopId, Instant now);

    /**
     * The first {@code limit} departures of one route from a platform strictly
     * after {@code now}, ordered by departure time.
     */
    List<Departure> findRouteDeparturesAfter(String stopId, String routeId, Instant now, int limit);
}
