package com.nextride.backend.service;

import com.nextride.backend.model.Departure;
import com.nextride.backend.model.Direction;
import com.nextride.backend.repository.RealtimeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Upcoming departures from a platform, computed against the live state as of
 * the injected clock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepartureService {

    public static final int ROUTE_DEPARTURE_LIMIT = 3;

    private final RealtimeRepository realtimeRepository;
    private final Clock clock;

    /**
     * The next departure of each route from a platform, ordered by route id.
     *
     * @param stopId platform id including its direction suffix, e.g. 127N
     */
    public List<Departure> getStationDepartures(String stopId) {
        requireId(stopId, "stopId");
        Instant now = clock.instant();

        Map<String, Departure> nextPerRoute = new LinkedHashMap<>();
        for (Departure departure : realtimeRepository.findDeparturesAfter(stopId, now)) {
            if (departure.getDepartureTime().isAfter(now)) {
                nextPerRoute.merge(departure.getRouteId(), departure,
                        (current, candidate) -> candidate.getDepartureTime().isBefore(current.getDepartureTime())
                                ? candidate
                                : current);
            }
        }

        List<Departure> departures = new ArrayList<>(nextPerRoute.values());
        departures.sort(Comparator.comparing(Departure::getRouteId, Comparator.nullsLast(Comparator.naturalOrder())));
        log.debug("Resolved {} station departures for {}", departures.size(), stopId);
        return departures;
    }

    /**
     * Up to three next departures of one route from a platform, soonest
     * first. Several trips of the same route may appear.
     */
    public List<Departure> getRouteDepartures(String stopId, String routeId) {
        requireId(stopId, "stopId");
        requireId(routeId, "routeId");
        Instant now = clock.instant();

        return realtimeRepository.findRouteDeparturesAfter(stopId, routeId, now, ROUTE_DEPARTURE_LIMIT).stream()
                .filter(departure -> departure.getDepartureTime().isAfter(now))
                .sorted(Comparator.comparing(Departure::getDepartureTime))
                .limit(ROUTE_DEPARTURE_LIMIT)
                .collect(Collectors.toList());
    }

    /**
     * Station departures for both platforms of a parent station.
     *
     * @param stationId base station id without a direction suffix, e.g. 127
     */
    public Map<Direction, List<Departure>> getDirectionalDepartures(String stationId) {
        requireId(stationId, "stationId");
        Map<Direction, List<Departure>> byDirection = new EnumMap<>(Direction.class);
        for (Direction direction : Direction.values()) {
            byDirection.put(direction, getDirectionDepartures(stationId, direction));
        }
        return byDirection;
    }

    /**
     * Station departures for one platform of a parent station.
     */
    public List<Departure> getDirectionDepartures(String stationId, Direction direction) {
        requireId(stationId, "stationId");
        return getStationDepartures(direction.platformId(stationId));
    }

    private static void requireId(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
