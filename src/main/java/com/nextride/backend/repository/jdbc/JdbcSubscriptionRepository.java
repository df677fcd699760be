package com.nextride.backend.repository.jdbc;

import com.nextride.backend.model.Subscription;
import com.nextride.backend.model.SubscriptionTarget;
import com.nextride.backend.repository.SubscriptionRepository;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Types;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class JdbcSubscriptionRepository implements SubscriptionRepository {

    protected final NamedParameterJdbcTemplate jdbc;

    public JdbcSubscriptionRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Long> findUserId(String username) {
        List<Long> ids = jdbc.queryForList("SELECT user_id FROM users WHERE username = :username",
                Map.of("username", username), Long.class);
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    @Override
    public void insertUser(String username) {
        jdbc.update("INSERT INTO users (username) VALUES (:username)", Map.of("username", username));
    }

    @Override
    public boolean exists(long userId, SubscriptionTarget target) {
        String column = target.getType() == SubscriptionTarget.Type.STOP ? "stop_id" : "route_id";
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM subscriptions WHERE user_id = :userId AND " + column + " = :targetId",
                Map.of("userId", userId, "targetId", target.getId()), Integer.class);
        return count != null && count > 0;
    }

    @Override
    public void insert(long userId, SubscriptionTarget target) {
        jdbc.update("INSERT INTO subscriptions (user_id, stop_id, route_id) VALUES (:userId, :stopId, :routeId)",
                new MapSqlParameterSource()
                        .addValue("userId", userId)
                        .addValue("stopId", target.getStopId(), Types.VARCHAR)
                        .addValue("routeId", target.getRouteId(), Types.VARCHAR));
    }

    @Override
    public List<Subscription> findByUser(long userId) {
        return jdbc.query("SELECT subscription_id, user_id, stop_id, route_id FROM subscriptions "
                + "WHERE user_id = :userId ORDER BY stop_id NULLS LAST, route_id NULLS LAST",
                Map.of("userId", userId),
                (rs, rowNum) -> Subscription.builder()
                        .subscriptionId(rs.getLong("subscription_id"))
                        .userId(rs.getLong("user_id"))
                        .target(SubscriptionTarget.fromColumns(rs.getString("stop_id"), rs.getString("route_id")))
                        .build());
    }

    @Override
    public int delete(long userId, long subscriptionId) {
        return jdbc.update("DELETE FROM subscriptions WHERE subscription_id = :subscriptionId AND user_id = :userId",
                Map.of("subscriptionId", subscriptionId, "userId", userId));
    }
}
