package com.nextride.backend.service;

import com.nextride.backend.model.AlertMatch;
import com.nextride.backend.model.AlertStatus;
import com.nextride.backend.model.UserAlert;
import com.nextride.backend.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Matches a rider's subscriptions against stored alerts and classifies each
 * match as active, upcoming or past. All three statuses are returned; picking
 * which ones to show is up to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertMatcherService {

    /**
     * Entity id, then status label descending (upcoming, past, active), then
     * period start with unbounded starts last.
     */
    static final Comparator<UserAlert> ALERT_ORDER = Comparator
            .comparing(UserAlert::getEntityId, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(alert -> alert.getStatus().getLabel(), Comparator.reverseOrder())
            .thenComparing(UserAlert::getStartTime, Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    private final AlertRepository alertRepository;
    private final Clock clock;

    public List<UserAlert> getUserAlerts(long userId) {
        Instant now = clock.instant();
        List<AlertMatch> matches = alertRepository.findMatchesForUser(userId);

        List<UserAlert> alerts = matches.stream()
                .map(match -> UserAlert.builder()
                        .alertId(match.getAlertId())
                        .headerText(match.getHeaderText())
                        .descriptionText(match.getDescriptionText())
                        .startTime(match.getStartTime())
                        .endTime(match.getEndTime())
                        .status(AlertStatus.classify(match.getStartTime(), match.getEndTime(), now))
                        .entityId(match.getEntityId())
                        .build())
                .sorted(ALERT_ORDER)
                .collect(Collectors.toList());

        log.debug("Matched {} alert rows for user {}", alerts.size(), userId);
        return alerts;
    }

    /**
     * Group alerts by route or stop, keeping the incoming order both across
     * and within groups.
     */
    public Map<String, List<UserAlert>> groupByEntity(List<UserAlert> alerts) {
        Map<String, List<UserAlert>> grouped = new LinkedHashMap<>();
        for (UserAlert alert : alerts) {
            grouped.computeIfAbsent(alert.getEntityId(), k -> new ArrayList<>()).add(alert);
        }
        return grouped;
    }
}
