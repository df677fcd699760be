package com.nextride.backend.service;

import com.nextride.backend.model.Alert;
import com.nextride.backend.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Upserts alerts by their stable id and replaces each alert's active periods
 * and informed entities. Alerts missing from the batch are left as they are.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertReconciler {

    private final AlertRepository alertRepository;
    private final Clock clock;

    /**
     * Each alert is written in its own transaction. A storage failure stops
     * the run and propagates; alerts written before it stay committed.
     *
     * @return number of alerts written
     */
    public int reconcile(List<Alert> alerts) {
        if (alerts.isEmpty()) {
            log.warn("⚠️ No alerts in the batch, stored alerts left unchanged");
            return 0;
        }

        Instant updatedAt = clock.instant();
        int written = 0;
        for (Alert alert : alerts) {
            if (alert.getAlertId() == null || alert.getAlertId().isEmpty()) {
                log.warn("⚠️ Skipping alert without id");
                continue;
            }
            alertRepository.upsertAlert(alert, updatedAt);
            written++;
        }
        log.info("✅ Upserted {} alerts", written);
        return written;
    }
}
