package com.nextride.backend.model;

import lombok.Value;

import java.util.List;

/**
 * A feed entity after decoding: either a trip update with its stop times, or
 * an alert. Each variant only carries the fields valid for it.
 */
public interface DecodedEntity {

    void addTo(DecodedFeed feed);

    @Value
    class TripUpdateEntity implements DecodedEntity {
        TripUpdate tripUpdate;
        List<StopTimeUpdate> stopTimeUpdates;

        @Override
        public void addTo(DecodedFeed feed) {
            feed.addTrip(tripUpdate, stopTimeUpdates);
        }
    }

    @Value
    class AlertEntity implements DecodedEntity {
        Alert alert;

        @Override
        public void addTo(DecodedFeed feed) {
            feed.addAlert(alert);
        }
    }
}
