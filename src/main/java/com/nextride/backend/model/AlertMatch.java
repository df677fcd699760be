package com.nextride.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One (alert, active period, informed entity) row matched by a user's
 * subscriptions, before temporal classification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertMatch {
    private String alertId;
    private String headerText;
    private String descriptionText;
    private Instant startTime;
    private Instant endTime;
    private String entityId; // route id, or stop id when the entity has no route
}
