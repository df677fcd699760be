package com.nextride.backend.repository.jdbc;

import com.nextride.backend.model.RouteInfo;
import com.nextride.backend.model.Station;
import com.nextride.backend.repository.StaticDataRepository;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class JdbcStaticDataRepository implements StaticDataRepository {

    protected final NamedParameterJdbcTemplate jdbc;

    public JdbcStaticDataRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<Station> findStations() {
        return jdbc.query("SELECT stop_id, stop_name, address, trains FROM stops "
                + "WHERE stop_id NOT LIKE '%N' AND stop_id NOT LIKE '%S' "
                + "ORDER BY stop_name, address, stop_id",
                (rs, rowNum) -> Station.builder()
                        .stopId(rs.getString("stop_id"))
                        .stopName(rs.getString("stop_name"))
                        .address(rs.getString("address"))
                        .trains(Station.parseTrains(rs.getString("trains")))
                        .build());
    }

    @Override
    public List<RouteInfo> findRoutes() {
        return jdbc.query("SELECT route_id, route_short_name, route_long_name FROM routes ORDER BY route_id ASC",
                (rs, rowNum) -> RouteInfo.builder()
                        .routeId(rs.getString("route_id"))
                        .shortName(rs.getString("route_short_name"))
                        .longName(rs.getString("route_long_name"))
                        .build());
    }

    @Override
    public Optional<String> findTrains(String stopId) {
        List<String> trains = jdbc.queryForList("SELECT trains FROM stops WHERE stop_id = :stopId",
                Map.of("stopId", stopId), String.class);
        return trains.isEmpty() ? Optional.empty() : Optional.ofNullable(trains.get(0));
    }
}
