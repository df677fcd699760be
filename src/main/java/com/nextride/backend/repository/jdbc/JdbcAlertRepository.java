package com.nextride.backend.repository.jdbc;

import com.nextride.backend.model.ActivePeriod;
import com.nextride.backend.model.Alert;
import com.nextride.backend.model.AlertMatch;
import com.nextride.backend.model.InformedEntity;
import com.nextride.backend.repository.AlertRepository;
import com.nextride.backend.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of the alert, active period and informed entity tables.
 */
@Slf4j
public class JdbcAlertRepository implements AlertRepository {

    private static final String UPDATE_ALERT = "UPDATE alerts "
            + "SET header_text = :headerText, description_text = :descriptionText, last_updated = :lastUpdated "
            + "WHERE alert_id = :alertId";

    private static final String INSERT_ALERT = "INSERT INTO alerts "
            + "(alert_id, header_text, description_text, last_updated) "
            + "VALUES (:alertId, :headerText, :descriptionText, :lastUpdated)";

    private static final String INSERT_PERIOD = "INSERT INTO active_periods (alert_id, start_time, end_time) "
            + "VALUES (:alertId, :startTime, :endTime)";

    private static final String INSERT_ENTITY = "INSERT INTO informed_entities "
            + "(alert_id, agency_id, route_id, stop_id) "
            + "VALUES (:alertId, :agencyId, :routeId, :stopId)";

    private static final String SELECT_USER_MATCHES = "SELECT a.alert_id, a.header_text, a.description_text, "
            + "ap.start_time, ap.end_time, COALESCE(ie.route_id, ie.stop_id) AS entity_id "
            + "FROM alerts a "
            + "JOIN active_periods ap ON a.alert_id = ap.alert_id "
            + "JOIN informed_entities ie ON a.alert_id = ie.alert_id "
            + "JOIN subscriptions s ON (s.route_id = ie.route_id OR s.stop_id = ie.stop_id) "
            + "WHERE s.user_id = :userId";

    protected final NamedParameterJdbcTemplate jdbc;
    protected final TransactionTemplate transactionTemplate;

    public JdbcAlertRepository(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void upsertAlert(Alert alert, Instant updatedAt) {
        String alertId = alert.getAlertId();
        MapSqlParameterSource alertParams = new MapSqlParameterSource()
                .addValue("alertId", alertId, Types.VARCHAR)
                .addValue("headerText", alert.getHeaderText(), Types.VARCHAR)
                .addValue("descriptionText", alert.getDescriptionText(), Types.VARCHAR)
                .addValue("lastUpdated", TimeUtils.toUtc(updatedAt), Types.TIMESTAMP_WITH_TIMEZONE);
        Map<String, Object> byAlertId = Map.of("alertId", alertId);

        transactionTemplate.executeWithoutResult(status -> {
            int updated = jdbc.update(UPDATE_ALERT, alertParams);
            if (updated == 0) {
                jdbc.update(INSERT_ALERT, alertParams);
            }

            jdbc.update("DELETE FROM active_periods WHERE alert_id = :alertId", byAlertId);
            if (!alert.getActivePeriods().isEmpty()) {
                jdbc.batchUpdate(INSERT_PERIOD, alert.getActivePeriods().stream()
                        .map(period -> periodParams(alertId, period))
                        .toArray(SqlParameterSource[]::new));
            }

            jdbc.update("DELETE FROM informed_entities WHERE alert_id = :alertId", byAlertId);
            if (!alert.getInformedEntities().isEmpty()) {
                jdbc.batchUpdate(INSERT_ENTITY, alert.getInformedEntities().stream()
                        .map(entity -> entityParams(alertId, entity))
                        .toArray(SqlParameterSource[]::new));
            }
        });
        log.debug("Upserted alert {} with {} periods and {} entities", alertId,
                alert.getActivePeriods().size(), alert.getInformedEntities().size());
    }

    @Override
    public Optional<Alert> findByAlertId(String alertId) {
        Map<String, Object> byAlertId = Map.of("alertId", alertId);
        List<Alert> alerts = jdbc.query(
                "SELECT alert_id, header_text, description_text, last_updated FROM alerts WHERE alert_id = :alertId",
                byAlertId,
                (rs, rowNum) -> Alert.builder()
                        .alertId(rs.getString("alert_id"))
                        .headerText(rs.getString("header_text"))
                        .descriptionText(rs.getString("description_text"))
                        .lastUpdated(TimeUtils.toInstant(rs.getObject("last_updated", OffsetDateTime.class)))
                        .build());
        if (alerts.isEmpty()) {
            return Optional.empty();
        }

        Alert alert = alerts.get(0);
        alert.setActivePeriods(jdbc.query(
                "SELECT start_time, end_time FROM active_periods WHERE alert_id = :alertId ORDER BY id",
                byAlertId,
                (rs, rowNum) -> ActivePeriod.builder()
                        .start(TimeUtils.toInstant(rs.getObject("start_time", OffsetDateTime.class)))
                        .end(TimeUtils.toInstant(rs.getObject("end_time", OffsetDateTime.class)))
                        .build()));
        alert.setInformedEntities(jdbc.query(
                "SELECT agency_id, route_id, stop_id FROM informed_entities WHERE alert_id = :alertId ORDER BY id",
                byAlertId,
                (rs, rowNum) -> InformedEntity.builder()
                        .agencyId(rs.getString("agency_id"))
                        .routeId(rs.getString("route_id"))
                        .stopId(rs.getString("stop_id"))
                        .build()));
        return Optional.of(alert);
    }

    @Override
    public List<AlertMatch> findMatchesForUser(long userId) {
        return jdbc.query(SELECT_USER_MATCHES, Map.of("userId", userId),
                (rs, rowNum) -> AlertMatch.builder()
                        .alertId(rs.getString("alert_id"))
                        .headerText(rs.getString("header_text"))
                        .descriptionText(rs.getString("description_text"))
                        .startTime(TimeUtils.toInstant(rs.getObject("start_time", OffsetDateTime.class)))
                        .endTime(TimeUtils.toInstant(rs.getObject("end_time", OffsetDateTime.class)))
                        .entityId(rs.getString("entity_id"))
                        .build());
    }

    private SqlParameterSource periodParams(String alertId, ActivePeriod period) {
        return new MapSqlParameterSource()
                .addValue("alertId", alertId, Types.VARCHAR)
                .addValue("startTime", TimeUtils.toUtc(period.getStart()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("endTime", TimeUtils.toUtc(period.getEnd()), Types.TIMESTAMP_WITH_TIMEZONE);
    }

    private SqlParameterSource entityParams(String alertId, InformedEntity entity) {
        return new MapSqlParameterSource()
                .addValue("alertId", alertId, Types.VARCHAR)
                .addValue("agencyId", entity.getAgencyId(), Types.VARCHAR)
                .addValue("routeId", entity.getRouteId(), Types.VARCHAR)
                .addValue("stopId", entity.getStopId(), Types.VARCHAR);
    }
}
