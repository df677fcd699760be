package com.nextride.backend.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalized records decoded from one or more feed messages.
 */
@Getter
public class DecodedFeed {

    private final List<TripUpdate> tripUpdates = new ArrayList<>();
    private final List<StopTimeUpdate> stopTimeUpdates = new ArrayList<>();
    private final List<Alert> alerts = new ArrayList<>();

    public void addTrip(TripUpdate tripUpdate, List<StopTimeUpdate> stopTimes) {
        tripUpdates.add(tripUpdate);
        stopTimeUpdates.addAll(stopTimes);
    }

    public void addAlert(Alert alert) {
        alerts.add(alert);
    }
}
