package com.nextride.backend.repository.jdbc;

import com.nextride.backend.model.Departure;
import com.nextride.backend.model.StopTimeUpdate;
import com.nextride.backend.model.TripUpdate;
import com.nextride.backend.repository.RealtimeRepository;
import com.nextride.backend.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * JDBC implementation of the live trip and stop-time tables.
 */
@Slf4j
public class JdbcRealtimeRepository implements RealtimeRepository {

    private static final String INSERT_TRIP = "INSERT INTO trips_real_time (trip_id, start_datetime, route_id) "
            + "VALUES (:tripId, :startDateTime, :routeId)";

    private static final String INSERT_STOP_TIME = "INSERT INTO stop_time_update "
            + "(trip_id, stop_id, arrival_time, departure_time) "
            + "VALUES (:tripId, :stopId, :arrivalTime, :departureTime)";

    private static final String SELECT_DEPARTURES = "SELECT t.route_id, stu.departure_time "
            + "FROM trips_real_time t "
            + "INNER JOIN stop_time_update stu ON t.trip_id = stu.trip_id "
            + "INNER JOIN stops s ON stu.stop_id = s.stop_id "
            + "WHERE s.stop_id = :stopId AND stu.departure_time > :now ";

    protected final NamedParameterJdbcTemplate jdbc;
    protected final TransactionTemplate transactionTemplate;

    public JdbcRealtimeRepository(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void replaceLiveState(List<TripUpdate> tripUpdates, List<StopTimeUpdate> stopTimeUpdates) {
        transactionTemplate.executeWithoutResult(status -> {
            jdbc.getJdbcOperations().update("DELETE FROM stop_time_update");
            jdbc.getJdbcOperations().update("DELETE FROM trips_real_time");

            if (!tripUpdates.isEmpty()) {
                jdbc.batchUpdate(INSERT_TRIP, tripUpdates.stream()
                        .map(this::tripParams)
                        .toArray(SqlParameterSource[]::new));
            }
            if (!stopTimeUpdates.isEmpty()) {
                jdbc.batchUpdate(INSERT_STOP_TIME, stopTimeUpdates.stream()
                        .map(this::stopTimeParams)
                        .toArray(SqlParameterSource[]::new));
            }
        });
        log.info("Replaced live state with {} trips and {} stop times", tripUpdates.size(), stopTimeUpdates.size());
    }

    @Override
    public List<TripUpdate> findAllTripUpdates() {
        return jdbc.query("SELECT trip_id, start_datetime, route_id FROM trips_real_time ORDER BY trip_id",
                (rs, rowNum) -> TripUpdate.builder()
                        .tripId(rs.getString("trip_id"))
                        .startDateTime(rs.getObject("start_datetime", LocalDateTime.class))
                        .routeId(rs.getString("route_id"))
                        .build());
    }

    @Override
    public List<StopTimeUpdate> findAllStopTimeUpdates() {
        return jdbc.query("SELECT trip_id, stop_id, arrival_time, departure_time FROM stop_time_update ORDER BY id",
                (rs, rowNum) -> StopTimeUpdate.builder()
                        .tripId(rs.getString("trip_id"))
                        .stopId(rs.getString("stop_id"))
                        .arrivalTime(TimeUtils.toInstant(rs.getObject("arrival_time", OffsetDateTime.class)))
                        .departureTime(TimeUtils.toInstant(rs.getObject("departure_time", OffsetDateTime.class)))
                        .build());
    }

    @Override
    public List<Departure> findDeparturesAfter(String stopId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("stopId", stopId)
                .addValue("now", TimeUtils.toUtc(now), Types.TIMESTAMP_WITH_TIMEZONE);
        return jdbc.query(SELECT_DEPARTURES + "ORDER BY t.route_id, stu.departure_time",
                params, departureMapper(now));
    }

    @Override
    public List<Departure> findRouteDeparturesAfter(String stopId, String routeId, Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("stopId", stopId)
                .addValue("routeId", routeId)
                .addValue("now", TimeUtils.toUtc(now), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("limit", limit);
        return jdbc.query(SELECT_DEPARTURES + "AND t.route_id = :routeId ORDER BY stu.departure_time LIMIT :limit",
                params, departureMapper(now));
    }

    private RowMapper<Departure> departureMapper(Instant now) {
        return (rs, rowNum) -> {
            Instant departure = TimeUtils.toInstant(rs.getObject("departure_time", OffsetDateTime.class));
            return Departure.builder()
                    .routeId(rs.getString("route_id"))
                    .departureTime(departure)
                    .etaMinutes(TimeUtils.etaMinutes(now, departure))
                    .build();
        };
    }

    private SqlParameterSource tripParams(TripUpdate trip) {
        return new MapSqlParameterSource()
                .addValue("tripId", trip.getTripId(), Types.VARCHAR)
                .addValue("startDateTime", trip.getStartDateTime(), Types.TIMESTAMP)
                .addValue("routeId", trip.getRouteId(), Types.VARCHAR);
    }

    private SqlParameterSource stopTimeParams(StopTimeUpdate stopTime) {
        return new MapSqlParameterSource()
                .addValue("tripId", stopTime.getTripId(), Types.VARCHAR)
                .addValue("stopId", stopTime.getStopId(), Types.VARCHAR)
                .addValue("arrivalTime", TimeUtils.toUtc(stopTime.getArrivalTime()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("departureTime", TimeUtils.toUtc(stopTime.getDepartureTime()), Types.TIMESTAMP_WITH_TIMEZONE);
    }
}
