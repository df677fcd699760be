package com.nextride.backend.repository;

import com.nextride.backend.model.Alert;
import com.nextride.backend.model.AlertMatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AlertRepository {

    /**
     * Insert or update the alert keyed by its alert id, then replace its
     * active periods and informed entities, all in one transaction.
     */
    void upsertAlert(Alert alert, Instant updatedAt);

    Optional<Alert> findByAlertId(String alertId);

    /**
     * Every (alert, active period, informed entity) combination whose entity
     * shares a route or stop with one of the user's subscriptions.
     */
    List<AlertMatch> findMatchesForUser(long userId);
}
