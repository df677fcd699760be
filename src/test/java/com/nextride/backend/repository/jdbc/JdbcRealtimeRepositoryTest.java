package com.nextride.backend.repository.jdbc;

import com.nextride.backend.model.Departure;
import com.nextride.backend.model.StopTimeUpdate;
import com.nextride.backend.model.TripUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.TimeZone;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRealtimeRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T14:00:00Z");

    private JdbcTestSupport db;
    private JdbcRealtimeRepository repository;

    @BeforeEach
    void setUp() {
        db = JdbcTestSupport.create();
        repository = new JdbcRealtimeRepository(db.jdbc, db.transactionTemplate);
        db.insertStop("127", "Times Sq-42 St", "Times Sq", "1,2,3");
        db.insertStop("127N", "Times Sq-42 St", "Times Sq", "1,2,3");
        db.insertStop("127S", "Times Sq-42 St", "Times Sq", "1,2,3");
    }

    @Test
    void testReplaceLiveState_ReplacesPreviousBatch() {
        repository.replaceLiveState(
                List.of(trip("T1", "1"), trip("T2", "2")),
                List.of(stopTime("T1", "127N", 120), stopTime("T2", "127N", 300)));

        repository.replaceLiveState(List.of(trip("T3", "3")), List.of(stopTime("T3", "127S", 60)));

        List<TripUpdate> trips = repository.findAllTripUpdates();
        assertEquals(1, trips.size());
        assertEquals("T3", trips.get(0).getTripId());
        assertEquals("3", trips.get(0).getRouteId());
        assertEquals(LocalDateTime.of(2024, 5, 1, 9, 30), trips.get(0).getStartDateTime());

        List<StopTimeUpdate> stopTimes = repository.findAllStopTimeUpdates();
        assertEquals(1, stopTimes.size());
        assertEquals("127S", stopTimes.get(0).getStopId());
        assertEquals(NOW.plusSeconds(60), stopTimes.get(0).getDepartureTime());
    }

    @Test
    void testReplaceLiveState_EmptyBatchClearsState() {
        repository.replaceLiveState(List.of(trip("T1", "1")), List.of(stopTime("T1", "127N", 120)));

        repository.replaceLiveState(Collections.emptyList(), Collections.emptyList());

        assertTrue(repository.findAllTripUpdates().isEmpty());
        assertTrue(repository.findAllStopTimeUpdates().isEmpty());
    }

    @Test
    void testReplaceLiveState_FailureKeepsPreviousState() {
        repository.replaceLiveState(List.of(trip("T1", "1")), List.of(stopTime("T1", "127N", 120)));

        // duplicate primary key fails the insert after the deletes have run
        assertThrows(DataAccessException.class, () -> repository.replaceLiveState(
                List.of(trip("T2", "2"), trip("T2", "2")),
                List.of(stopTime("T2", "127N", 60))));

        List<TripUpdate> trips = repository.findAllTripUpdates();
        assertEquals(1, trips.size());
        assertEquals("T1", trips.get(0).getTripId());
        assertEquals(1, repository.findAllStopTimeUpdates().size());
    }

    @Test
    void testFindDeparturesAfter_OnlyFutureDeparturesAtStop() {
        repository.replaceLiveState(
                List.of(trip("T1", "1"), trip("T2", "2"), trip("T3", "1"), trip("T4", "3")),
                List.of(stopTime("T1", "127N", 120),
                        stopTime("T2", "127N", -60),
                        stopTime("T3", "127N", 600),
                        stopTime("T4", "127S", 30)));

        List<Departure> departures = repository.findDeparturesAfter("127N", NOW);

        assertEquals(2, departures.size());
        assertEquals("1", departures.get(0).getRouteId());
        assertEquals(2, departures.get(0).getEtaMinutes());
        assertEquals("1", departures.get(1).getRouteId());
        assertEquals(10, departures.get(1).getEtaMinutes());
    }

    @Test
    void testFindDeparturesAfter_DepartureExactlyNowExcluded() {
        repository.replaceLiveState(List.of(trip("T1", "1")), List.of(stopTime("T1", "127N", 0)));

        assertTrue(repository.findDeparturesAfter("127N", NOW).isEmpty());
    }

    @Test
    void testFindRouteDeparturesAfter_LimitsAndOrders() {
        repository.replaceLiveState(
                List.of(trip("T1", "1"), trip("T2", "1"), trip("T3", "1"), trip("T4", "1"), trip("T5", "2")),
                List.of(stopTime("T1", "127N", 900),
                        stopTime("T2", "127N", 120),
                        stopTime("T3", "127N", 480),
                        stopTime("T4", "127N", 300),
                        stopTime("T5", "127N", 60)));

        List<Departure> departures = repository.findRouteDeparturesAfter("127N", "1", NOW, 3);

        assertEquals(3, departures.size());
        assertEquals(List.of(2L, 5L, 8L), departures.stream().map(Departure::getEtaMinutes).collect(Collectors.toList()));
    }

    @Test
    void testFindDeparturesAfter_AcrossFallBackHourInLocalZone() {
        TimeZone original = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
        try {
            JdbcTestSupport newYorkDb = JdbcTestSupport.create();
            newYorkDb.insertStop("127N", "Times Sq-42 St", "Times Sq", "1,2,3");
            JdbcRealtimeRepository newYorkRepository =
                    new JdbcRealtimeRepository(newYorkDb.jdbc, newYorkDb.transactionTemplate);

            // 01:10 EDT and 01:20 EST, on either side of the repeated hour
            Instant now = Instant.parse("2024-11-03T05:10:00Z");
            Instant departure = Instant.parse("2024-11-03T06:20:00Z");
            newYorkRepository.replaceLiveState(List.of(trip("T1", "1")), List.of(StopTimeUpdate.builder()
                    .tripId("T1").stopId("127N").departureTime(departure).build()));

            List<Departure> departures = newYorkRepository.findDeparturesAfter("127N", now);

            assertEquals(1, departures.size());
            assertEquals(departure, departures.get(0).getDepartureTime());
            assertEquals(70, departures.get(0).getEtaMinutes());
            assertTrue(newYorkRepository.findDeparturesAfter("127N", departure).isEmpty());
        } finally {
            TimeZone.setDefault(original);
        }
    }

    private static TripUpdate trip(String tripId, String routeId) {
        return TripUpdate.builder()
                .tripId(tripId)
                .routeId(routeId)
                .startDateTime(LocalDateTime.of(2024, 5, 1, 9, 30))
                .build();
    }

    private static StopTimeUpdate stopTime(String tripId, String stopId, long secondsFromNow) {
        Instant time = NOW.plusSeconds(secondsFromNow);
        return StopTimeUpdate.builder()
                .tripId(tripId)
                .stopId(stopId)
                .arrivalTime(time)
                .departureTime(time)
                .build();
    }
}
