package com.nextride.backend.repository.jdbc;

import com.nextride.backend.model.RouteInfo;
import com.nextride.backend.model.Station;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStaticDataRepositoryTest {

    private JdbcTestSupport db;
    private JdbcStaticDataRepository repository;

    @BeforeEach
    void setUp() {
        db = JdbcTestSupport.create();
        repository = new JdbcStaticDataRepository(db.jdbc);
    }

    @Test
    void testFindStations_ExcludesPlatforms() {
        db.insertStop("127", "Times Sq-42 St", "Times Sq", "1,2,3");
        db.insertStop("127N", "Times Sq-42 St", "Times Sq", "1,2,3");
        db.insertStop("127S", "Times Sq-42 St", "Times Sq", "1,2,3");
        db.insertStop("A27", "42 St-Port Authority Bus Terminal", "8 Av", "A, C, E");

        List<Station> stations = repository.findStations();

        assertEquals(2, stations.size());
        assertEquals("A27", stations.get(0).getStopId());
        assertEquals(List.of("A", "C", "E"), stations.get(0).getTrains());
        assertEquals("127", stations.get(1).getStopId());
    }

    @Test
    void testFindRoutes_OrderedById() {
        db.insertRoute("L", "L", "14 St-Canarsie Local");
        db.insertRoute("1", "1", "Broadway - 7 Avenue Local");

        List<RouteInfo> routes = repository.findRoutes();

        assertEquals(2, routes.size());
        assertEquals("1", routes.get(0).getRouteId());
        assertEquals("14 St-Canarsie Local", routes.get(1).getLongName());
    }

    @Test
    void testFindTrains() {
        db.insertStop("127N", "Times Sq-42 St", "Times Sq", "1,2,3");
        db.insertStop("901", "Grand Central-42 St", "42 St", null);

        assertEquals(Optional.of("1,2,3"), repository.findTrains("127N"));
        assertTrue(repository.findTrains("901").isEmpty());
        assertTrue(repository.findTrains("missing").isEmpty());
    }
}
