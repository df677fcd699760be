package com.nextride.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * Temporal status of an alert's active period relative to a point in time.
 */
public enum AlertStatus {

    ACTIVE("active"),
    PAST("past"),
    UPCOMING("upcoming");

    private final String label;

    AlertStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Upcoming when the period starts strictly after {@code now}, past when it
     * ends strictly before {@code now}, active otherwise. Null bounds never
     * make a period upcoming or past.
     */
    public static AlertStatus classify(Instant start, Instant end, Instant now) {
        if (start != null && start.isAfter(now)) {
            return UPCOMING;
        }
        if (end != null && end.isBefore(now)) {
            return PAST;
        }
        return ACTIVE;
    }
}
